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
 * CLI command: eventstorming import &lt;file&gt;
 * <p>
 * Reads an export document from a file, or from stdin when the file is {@code -}.
 */
@Command(name = "import", mixinStandardHelpOptions = true, description = "Import an exported workshop as a new workshop")
@Component
public class ImportCommand extends WorkshopCommandSupport {

    @Parameters(index = "0", description = "Export file, or - for stdin")
    private String source;

    @Option(names = "--name", description = "Name for the imported workshop")
    private String newName;

    public ImportCommand(WorkshopService service, RendererRegistry renderers) {
        super(service, renderers);
    }

    @Override
    protected int execute(WorkshopRenderer renderer) {
        return emit(service.importWorkshop(read(), newName), renderer);
    }

    private String read() {
        try {
            if ("-".equals(source)) {
                return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
            }
            return Files.readString(Path.of(source), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WorkshopStorageException("Failed to read import data from " + source, e);
        }
    }
}
