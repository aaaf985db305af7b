package org.carball.pivot.cli;

import lombok.Data;
import org.carball.pivot.model.analysis.SourceLanguage;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Data
public class CliOptions {
    private String command;
    private List<Path> inputs = new ArrayList<>();
    private SourceLanguage language;
    private String profileName = "balanced";
    private Path settingsFile;
    private Path output;
    private List<String> functions = new ArrayList<>();
    private List<Object> arguments = new ArrayList<>();
    private String baselineName;
    private String saveBaselineName;
    private boolean verbose;
}
