package com.eventstorming.dispatch.cli;

import com.eventstorming.core.model.NotFoundException;
import com.eventstorming.core.model.OperationResult;
import com.eventstorming.core.model.WorkshopValidationException;
import com.eventstorming.core.persistence.WorkshopStorageException;
import com.eventstorming.core.service.WorkshopService;
import com.eventstorming.dispatch.render.OutputFormat;
import com.eventstorming.dispatch.render.RendererRegistry;
import com.eventstorming.dispatch.render.WorkshopRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Mixin;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Common plumbing for workshop subcommands: resolves the renderer for the
 * requested format and turns domain exceptions into a structured error
 * with a suggestion and a non-zero exit code.
 */
public abstract class WorkshopCommandSupport implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(WorkshopCommandSupport.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_NOT_FOUND = 3;
    static final int EXIT_INVALID = 4;
    static final int EXIT_STORAGE = 5;

    @Mixin
    OutputOptions output = new OutputOptions();

    protected final WorkshopService service;
    private final RendererRegistry renderers;

    protected WorkshopCommandSupport(WorkshopService service, RendererRegistry renderers) {
        this.service = service;
        this.renderers = renderers;
    }

    @Override
    public Integer call() {
        WorkshopRenderer renderer = renderers.forFormat(output.format());
        try {
            return execute(renderer);
        } catch (NotFoundException e) {
            ConsoleOutput.plain(renderer.error(e.getMessage(), suggestionFor(e.getKind())));
            return EXIT_NOT_FOUND;
        } catch (WorkshopValidationException e) {
            ConsoleOutput.plain(renderer.error(e.getMessage(), "Run the command with --help to check its arguments"));
            return EXIT_INVALID;
        } catch (WorkshopStorageException e) {
            log.error("Storage failure", e);
            ConsoleOutput.plain(renderer.error(e.getMessage(),
                    "Check that the storage directory exists and is writable"));
            return EXIT_STORAGE;
        }
    }

    protected abstract int execute(WorkshopRenderer renderer);

    /**
     * Prints a mutation outcome; failures map to a non-zero exit code.
     */
    protected int emit(OperationResult result, WorkshopRenderer renderer) {
        String text = renderer.operationResult(result);
        if (renderer.format() == OutputFormat.JSON) {
            ConsoleOutput.plain(text);
        } else if (result.success()) {
            ConsoleOutput.success(text);
        } else {
            ConsoleOutput.error(text);
        }
        return result.success() ? EXIT_OK : EXIT_FAILED;
    }

    protected int print(String text) {
        ConsoleOutput.plain(text);
        return EXIT_OK;
    }

    static String suggestionFor(NotFoundException.Kind kind) {
        return switch (kind) {
            case WORKSHOP -> "Use 'eventstorming list' to see available workshops";
            case ELEMENT, START_ELEMENT -> "Use 'eventstorming search' or 'eventstorming timeline' to find element ids";
            case CONTEXT -> "Use 'eventstorming contexts' to see bounded contexts";
        };
    }

    /** Drops blank entries so {@code --triggers ""} clears a list. */
    static List<String> ids(List<String> values) {
        if (values == null) {
            return null;
        }
        return values.stream().map(String::strip).filter(v -> !v.isEmpty()).toList();
    }
}
