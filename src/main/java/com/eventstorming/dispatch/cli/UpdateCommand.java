package com.eventstorming.dispatch.cli;

import com.eventstorming.core.model.ElementPatch;
import com.eventstorming.core.service.WorkshopService;
import com.eventstorming.dispatch.render.RendererRegistry;
import com.eventstorming.dispatch.render.WorkshopRenderer;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: eventstorming update &lt;workshop-id&gt; &lt;element-id&gt;
 * <p>
 * Only the given options are written. {@code --context null} clears the context.
 */
@Command(name = "update", mixinStandardHelpOptions = true, description = "Update fields of an element")
@Component
public class UpdateCommand extends WorkshopCommandSupport {

    @Parameters(index = "0", description = "Workshop ID")
    private String workshopId;

    @Parameters(index = "1", description = "Element ID")
    private String elementId;

    @Option(names = "--name", description = "New name")
    private String name;

    @Option(names = "--position", description = "New timeline position")
    private Integer position;

    @Option(names = "--notes", description = "New notes")
    private String notes;

    @Option(names = "--triggers", split = ",", description = "Replacement list of triggered element ids")
    private List<String> triggers;

    @Option(names = "--triggered-by", split = ",", description = "Replacement list of triggering element ids")
    private List<String> triggeredBy;

    @Option(names = "--context", description = "Bounded context ID, or 'null' to clear it")
    private String contextId;

    public UpdateCommand(WorkshopService service, RendererRegistry renderers) {
        super(service, renderers);
    }

    @Override
    protected int execute(WorkshopRenderer renderer) {
        var patch = new ElementPatch(name, position, notes, ids(triggers), ids(triggeredBy), contextId);
        if (patch.isEmpty()) {
            ConsoleOutput.warn("Nothing to update; pass at least one of --name, --position, --notes, "
                    + "--triggers, --triggered-by or --context");
            return EXIT_FAILED;
        }
        return emit(service.updateElement(workshopId, elementId, patch), renderer);
    }
}
