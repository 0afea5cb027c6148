package com.eventstorming.dispatch.cli;

import com.eventstorming.core.persistence.WorkshopStorageException;
import com.eventstorming.core.service.WorkshopService;
import com.eventstorming.dispatch.render.RendererRegistry;
import com.eventstorming.dispatch.render.WorkshopRenderer;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CLI command: eventstorming export &lt;workshop-id&gt;
 * <p>
 * Writes the export document to stdout, or to {@code --output}. The export is
 * always JSON regardless of {@code --format}.
 */
@Command(name = "export", mixinStandardHelpOptions = true, description = "Export a workshop as JSON")
@Component
public class ExportCommand extends WorkshopCommandSupport {

    @Parameters(index = "0", description = "Workshop ID")
    private String workshopId;

    // Defaults to true, so the declared name is the negative form; picocli adds --include-metadata.
    @Option(names = "--no-include-metadata", negatable = true, defaultValue = "true",
            description = "Reduce metadata to name, domain and description")
    private boolean includeMetadata;

    @Option(names = {"--output", "-o"}, description = "File to write instead of stdout")
    private Path outputFile;

    public ExportCommand(WorkshopService service, RendererRegistry renderers) {
        super(service, renderers);
    }

    @Override
    protected int execute(WorkshopRenderer renderer) {
        String json = service.exportWorkshop(workshopId, includeMetadata);
        if (outputFile == null) {
            return print(json);
        }
        try {
            Files.writeString(outputFile, json, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WorkshopStorageException("Failed to write export to " + outputFile, e);
        }
        ConsoleOutput.success("Exported workshop " + workshopId + " to " + outputFile);
        return EXIT_OK;
    }
}
