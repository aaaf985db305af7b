package org.carball.pivot.synthesizer;

/**
 * Source templates for vessels and interpreter shims. Slots use {@code ${name}} syntax and
 * are filled by {@link TemplateRenderer}.
 */
public final class VesselTemplate {

    private VesselTemplate() {
    }

    public static final String GO_PROGRAM = """
        // Code generated by pivot for ${function_name}. DO NOT EDIT.
        // Compiler flags: ${compiler_flags}
        package main

        import (
            "encoding/json"
            "fmt"
            "os"
            "os/exec"
            "strconv"
            "strings"
        )

        var shimCommand = []string{${shim_command}}

        func fail(message string, err error) {
            fmt.Fprintln(os.Stderr, message, err)
            os.Exit(1)
        }

        func runShim(args ...string) string {
            if len(shimCommand) == 0 {
                fail("no interpreter shim configured", nil)
            }
            commandArgs := append(append([]string{}, shimCommand[1:]...), args...)
            out, err := exec.Command(shimCommand[0], commandArgs...).Output()
            if err != nil {
                fail("shim failed:", err)
            }
            lines := strings.Split(strings.TrimSpace(string(out)), "\\n")
            return strings.TrimSpace(lines[len(lines)-1])
        }

        func decodeJSON(raw string, target interface{}) {
            if err := json.Unmarshal([]byte(raw), target); err != nil {
                fail("unexpected shim output:", err)
            }
        }

        func parseInt(value string) int64 {
            parsed, err := strconv.ParseInt(value, 10, 64)
            if err != nil {
                fail("invalid int argument:", err)
            }
            return parsed
        }

        func parseFloat(value string) float64 {
            parsed, err := strconv.ParseFloat(value, 64)
            if err != nil {
                fail("invalid float argument:", err)
            }
            return parsed
        }

        func parseBool(value string) bool {
            parsed, err := strconv.ParseBool(value)
            if err != nil {
                fail("invalid bool argument:", err)
            }
            return parsed
        }

        func parseString(value string) string {
            return value
        }

        func ${function_name}(${arguments}) ${return_type} {
        ${body}
        }

        func main() {
            args := os.Args[1:]
            if len(args) != ${argument_count} {
                fmt.Fprintf(os.Stderr, "expected ${argument_count} arguments, got %d\\n", len(args))
                os.Exit(2)
            }
        ${argument_parsing}
            out, err := json.Marshal(${function_name}(${call_arguments}))
            if err != nil {
                fail("cannot encode result:", err)
            }
            fmt.Println(string(out))
        }
        """;

    public static final String CPP_PROGRAM = """
        // Generated by pivot for ${function_name}
        // Compiler flags: ${compiler_flags}
        #include <array>
        #include <cstdio>
        #include <cstdlib>
        #include <iomanip>
        #include <iostream>
        #include <sstream>
        #include <string>
        #include <vector>

        struct RawJson {
            std::string text;
        };

        static const std::vector<std::string> SHIM_COMMAND = {${shim_command}};

        static void fail(const std::string& message) {
            std::cerr << message << std::endl;
            std::exit(1);
        }

        static std::string shell_quote(const std::string& value) {
            std::string quoted = "'";
            for (char c : value) {
                if (c == '\\'') {
                    quoted += "'\\\\''";
                } else {
                    quoted += c;
                }
            }
            return quoted + "'";
        }

        static std::string run_shim(const std::vector<std::string>& args) {
            if (SHIM_COMMAND.empty()) {
                fail("no interpreter shim configured");
            }
            std::string command;
            for (const auto& part : SHIM_COMMAND) {
                command += shell_quote(part) + " ";
            }
            for (const auto& arg : args) {
                command += shell_quote(arg) + " ";
            }
            FILE* pipe = popen(command.c_str(), "r");
            if (pipe == nullptr) {
                fail("shim failed to start");
            }
            std::string output;
            std::array<char, 4096> buffer{};
            while (fgets(buffer.data(), static_cast<int>(buffer.size()), pipe) != nullptr) {
                output += buffer.data();
            }
            if (pclose(pipe) != 0) {
                fail("shim failed");
            }
            while (!output.empty() && (output.back() == '\\n' || output.back() == '\\r' || output.back() == ' ')) {
                output.pop_back();
            }
            std::size_t newline = output.find_last_of('\\n');
            return newline == std::string::npos ? output : output.substr(newline + 1);
        }

        static void decode_json(const std::string& raw, long long& out) { out = std::stoll(raw); }
        static void decode_json(const std::string& raw, double& out) { out = std::stod(raw); }
        static void decode_json(const std::string& raw, bool& out) { out = raw == "true"; }
        static void decode_json(const std::string& raw, std::string& out) {
            out = raw.size() >= 2 && raw.front() == '"' ? raw.substr(1, raw.size() - 2) : raw;
        }
        static void decode_json(const std::string& raw, RawJson& out) { out.text = raw; }

        static std::string to_arg(long long value) { return std::to_string(value); }
        static std::string to_arg(double value) {
            std::ostringstream stream;
            stream << std::setprecision(17) << value;
            return stream.str();
        }
        static std::string to_arg(bool value) { return value ? "true" : "false"; }
        static std::string to_arg(const std::string& value) { return value; }

        static long long parse_int(const char* value) { return std::stoll(value); }
        static double parse_float(const char* value) { return std::stod(value); }
        static bool parse_bool(const char* value) {
            std::string text(value);
            return text == "true" || text == "True" || text == "1";
        }
        static std::string parse_string(const char* value) { return std::string(value); }

        static void emit(long long value) { std::cout << value << std::endl; }
        static void emit(double value) { std::cout << std::setprecision(17) << value << std::endl; }
        static void emit(bool value) { std::cout << (value ? "true" : "false") << std::endl; }
        static void emit(const std::string& value) {
            std::string escaped;
            for (char c : value) {
                if (c == '"' || c == '\\\\') {
                    escaped += '\\\\';
                }
                escaped += c;
            }
            std::cout << '"' << escaped << '"' << std::endl;
        }
        static void emit(const RawJson& value) { std::cout << value.text << std::endl; }

        ${return_type} ${function_name}(${arguments}) {
        ${body}
        }

        int main(int argc, char** argv) {
            if (argc - 1 != ${argument_count}) {
                std::cerr << "expected ${argument_count} arguments, got " << (argc - 1) << std::endl;
                return 2;
            }
        ${argument_parsing}
            emit(${function_name}(${call_arguments}));
            return 0;
        }
        """;

    public static final String RUST_PROGRAM = """
        // Generated by pivot for ${function_name}
        // Compiler flags: ${compiler_flags}
        #![allow(dead_code, unused_variables, unused_mut, non_snake_case)]

        use std::process::Command;

        struct RawJson(String);

        const SHIM_COMMAND: &[&str] = &[${shim_command}];

        fn fail(message: &str) -> ! {
            eprintln!("{}", message);
            std::process::exit(1)
        }

        fn run_shim(args: &[String]) -> String {
            if SHIM_COMMAND.is_empty() {
                fail("no interpreter shim configured");
            }
            let output = Command::new(SHIM_COMMAND[0])
                .args(&SHIM_COMMAND[1..])
                .args(args)
                .output()
                .unwrap_or_else(|e| fail(&format!("shim failed: {}", e)));
            if !output.status.success() {
                fail(&format!("shim failed: {}", String::from_utf8_lossy(&output.stderr)));
            }
            let text = String::from_utf8_lossy(&output.stdout).to_string();
            text.lines()
                .filter(|line| !line.trim().is_empty())
                .last()
                .unwrap_or("")
                .trim()
                .to_string()
        }

        trait FromJson: Sized {
            fn from_json(raw: &str) -> Self;
        }

        impl FromJson for i64 {
            fn from_json(raw: &str) -> Self {
                raw.parse::<i64>()
                    .or_else(|_| raw.parse::<f64>().map(|v| v as i64))
                    .unwrap_or_else(|_| fail("unexpected shim output"))
            }
        }

        impl FromJson for f64 {
            fn from_json(raw: &str) -> Self {
                raw.parse::<f64>().unwrap_or_else(|_| fail("unexpected shim output"))
            }
        }

        impl FromJson for bool {
            fn from_json(raw: &str) -> Self {
                raw == "true"
            }
        }

        impl FromJson for String {
            fn from_json(raw: &str) -> Self {
                raw.trim_matches('"').to_string()
            }
        }

        impl FromJson for RawJson {
            fn from_json(raw: &str) -> Self {
                RawJson(raw.to_string())
            }
        }

        trait ToJson {
            fn to_json(&self) -> String;
        }

        impl ToJson for i64 {
            fn to_json(&self) -> String {
                self.to_string()
            }
        }

        impl ToJson for f64 {
            fn to_json(&self) -> String {
                format!("{:?}", self)
            }
        }

        impl ToJson for bool {
            fn to_json(&self) -> String {
                self.to_string()
            }
        }

        impl ToJson for String {
            fn to_json(&self) -> String {
                format!("{:?}", self)
            }
        }

        impl ToJson for RawJson {
            fn to_json(&self) -> String {
                self.0.clone()
            }
        }

        fn parse_arg<T: std::str::FromStr>(value: &str) -> T {
            value.parse::<T>().unwrap_or_else(|_| {
                eprintln!("invalid argument: {}", value);
                std::process::exit(2)
            })
        }

        fn ${function_name}(${arguments}) -> ${return_type} {
        ${body}
        }

        fn main() {
            let args: Vec<String> = std::env::args().skip(1).collect();
            if args.len() != ${argument_count} {
                eprintln!("expected ${argument_count} arguments, got {}", args.len());
                std::process::exit(2);
            }
        ${argument_parsing}
            println!("{}", ${function_name}(${call_arguments}).to_json());
        }
        """;

    public static final String PYTHON_SHIM = """
        #!/usr/bin/env python3
        # Interpreter shim generated by pivot for ${function_name}
        import hashlib
        import json
        import math
        import sys
        import time


        ${original_source}


        def _to_bool(value):
            return value.strip().lower() in ("1", "true", "yes")


        _CONVERTERS = [${argument_converters}]

        if __name__ == "__main__":
            _args = sys.argv[1:]
            if len(_args) != len(_CONVERTERS):
                sys.stderr.write("expected %d arguments, got %d\\n" % (len(_CONVERTERS), len(_args)))
                sys.exit(2)
            _result = ${function_name}(*[convert(arg) for convert, arg in zip(_CONVERTERS, _args)])
            print(json.dumps(_result, default=str))
        """;

    public static final String RUBY_SHIM = """
        #!/usr/bin/env ruby
        # Interpreter shim generated by pivot for ${function_name}
        require 'json'
        require 'digest'

        ${original_source}

        if __FILE__ == $PROGRAM_NAME
          converters = [${argument_converters}]
          if ARGV.length != converters.length
            warn "expected #{converters.length} arguments, got #{ARGV.length}"
            exit 2
          end
          args = ARGV.each_with_index.map { |arg, i| converters[i].call(arg) }
          puts JSON.generate(${function_name}(*args))
        end
        """;

    public static final String JAVASCRIPT_SHIM = """
        #!/usr/bin/env node
        // Interpreter shim generated by pivot for ${function_name}

        ${original_source}

        const pivotConverters = [${argument_converters}];
        const pivotArgs = process.argv.slice(2);
        if (pivotArgs.length !== pivotConverters.length) {
            process.stderr.write('expected ' + pivotConverters.length + ' arguments, got ' + pivotArgs.length + '\\n');
            process.exit(2);
        }
        console.log(JSON.stringify(${function_name}(...pivotArgs.map((arg, i) => pivotConverters[i](arg)))));
        """;
}
