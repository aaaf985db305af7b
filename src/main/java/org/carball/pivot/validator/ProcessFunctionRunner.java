package org.carball.pivot.validator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.pivot.config.PipelineSettings;
import org.carball.pivot.model.synthesis.VesselRecord;
import org.carball.pivot.model.synthesis.VesselStatus;
import org.carball.pivot.process.ProcessExecutor;
import org.carball.pivot.process.ProcessOutput;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Invokes a function implemented by an external program. Arguments are passed on the command
 * line; the last non-blank line of stdout is the result, decoded as JSON when possible.
 */
@Slf4j
public class ProcessFunctionRunner implements FunctionRunner {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<String> command;
    private final Duration timeout;
    private final ProcessExecutor executor;

    public ProcessFunctionRunner(List<String> command, Duration timeout) {
        this(command, timeout, new ProcessExecutor());
    }

    ProcessFunctionRunner(List<String> command, Duration timeout, ProcessExecutor executor) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Runner command must not be empty");
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
        this.executor = executor;
    }

    /**
     * Runs the vessel binary when it has one, otherwise its interpreter shim.
     *
     * @throws IllegalArgumentException if the vessel failed to build
     */
    public static ProcessFunctionRunner forVessel(VesselRecord vessel, PipelineSettings settings) {
        if (vessel.status() == VesselStatus.ERROR) {
            throw new IllegalArgumentException("Vessel " + vessel.functionName() + " failed to build and cannot run");
        }
        Duration timeout = Duration.ofMillis(settings.getValidation().getCallTimeoutMs());
        if (vessel.status().hasBinary() && vessel.binaryPath() != null) {
            return new ProcessFunctionRunner(List.of(vessel.binaryPath()), timeout);
        }
        return forLegacy(vessel, settings);
    }

    /**
     * Runs the original function through its interpreter shim.
     */
    public static ProcessFunctionRunner forLegacy(VesselRecord vessel, PipelineSettings settings) {
        if (vessel.shimPath() == null) {
            throw new IllegalArgumentException("Vessel " + vessel.functionName() + " has no interpreter shim");
        }
        Duration timeout = Duration.ofMillis(settings.getValidation().getCallTimeoutMs());
        return new ProcessFunctionRunner(
                List.of(settings.interpreterFor(vessel.sourceLanguage()), vessel.shimPath()), timeout);
    }

    public List<String> command() {
        return command;
    }

    @Override
    public Object invoke(List<Object> arguments) throws Exception {
        List<String> fullCommand = new ArrayList<>(command);
        for (Object argument : arguments) {
            fullCommand.add(String.valueOf(argument));
        }

        ProcessOutput output = executor.run(fullCommand, timeout);
        if (output.timedOut()) {
            throw new TimeoutException(command.get(0) + " did not finish within " + timeout.toMillis() + "ms");
        }
        if (output.exitCode() != 0) {
            throw new IOException(command.get(0) + " exited with code " + output.exitCode() + ": "
                    + output.stderr().trim());
        }
        return decode(output.lastStdoutLine());
    }

    static Object decode(String line) {
        if (line.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.readValue(line, Object.class);
        } catch (JsonProcessingException e) {
            log.trace("Output is not JSON, keeping raw text: {}", line);
            return line;
        }
    }
}
