package org.carball.pivot.synthesizer;

import org.carball.pivot.config.OptimizationProfile;
import org.carball.pivot.model.analysis.TargetLanguage;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps an optimization profile to command-line flags for each compiler.
 */
public final class CompilerFlagBuilder {

    private CompilerFlagBuilder() {
    }

    public static List<String> flagsFor(TargetLanguage target, OptimizationProfile profile) {
        List<String> flags = new ArrayList<>();

        switch (target) {
            case COMPILED_CONCURRENT -> {
                // go build has no optimization levels; level 0 disables optimizations and inlining
                if (profile.getOptLevel() == 0) {
                    flags.add("-gcflags=all=-N -l");
                } else if (profile.isUnsafe()) {
                    flags.add("-gcflags=-B");
                }
                if (profile.getOptLevel() >= 3) {
                    flags.add("-trimpath");
                }
            }
            case COMPILED_NATIVE -> {
                flags.add("-std=c++17");
                flags.add("-O" + profile.getOptLevel());
                if (profile.isSimd()) {
                    flags.add("-march=native");
                }
                if (profile.isLto()) {
                    flags.add("-flto");
                }
                if (profile.isUnsafe()) {
                    flags.add("-DNDEBUG");
                    flags.add("-fno-stack-protector");
                }
            }
            case MEMORY_SAFE_NATIVE -> {
                flags.add("-C");
                flags.add("opt-level=" + profile.getOptLevel());
                if (profile.isSimd()) {
                    flags.add("-C");
                    flags.add("target-cpu=native");
                }
                if (profile.isLto()) {
                    flags.add("-C");
                    flags.add("lto");
                }
                if (profile.isUnsafe()) {
                    flags.add("-C");
                    flags.add("overflow-checks=off");
                    flags.add("-C");
                    flags.add("debug-assertions=off");
                }
            }
            case INTERPRETED -> throw new IllegalArgumentException("Interpreted target is not compiled");
        }

        flags.addAll(tokenize(profile.extraFlagsFor(target)));
        return flags;
    }

    /**
     * Splits on whitespace outside single or double quotes; quotes are removed.
     */
    static List<String> tokenize(String flags) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        boolean inToken = false;

        for (char c : flags.toCharArray()) {
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }

        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }
}
