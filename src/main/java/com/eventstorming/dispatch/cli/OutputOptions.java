package com.eventstorming.dispatch.cli;

import com.eventstorming.dispatch.render.OutputFormat;
import picocli.CommandLine.Option;

/**
 * Output format shared by every workshop command.
 */
public class OutputOptions {

    @Option(names = {"--format", "-f"}, description = "Output format: markdown or json (default: ${DEFAULT-VALUE})",
            defaultValue = "markdown", converter = Converters.OutputFormatConverter.class)
    OutputFormat format = OutputFormat.MARKDOWN;

    public OutputFormat format() {
        return format;
    }
}
