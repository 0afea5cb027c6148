package com.eventstorming.dispatch.cli;

import com.eventstorming.core.model.ElementDraft;
import com.eventstorming.core.model.ElementType;
import com.eventstorming.core.service.WorkshopService;
import com.eventstorming.dispatch.render.RendererRegistry;
import com.eventstorming.dispatch.render.WorkshopRenderer;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: eventstorming add &lt;workshop-id&gt; &lt;type&gt; &lt;name&gt;
 * <p>
 * Without {@code --position} the element is appended to the lane of its type.
 */
@Command(name = "add", mixinStandardHelpOptions = true, description = "Add an element (event, command, policy, ...)")
@Component
public class AddCommand extends WorkshopCommandSupport {

    @Parameters(index = "0", description = "Workshop ID")
    private String workshopId;

    @Parameters(index = "1", description = "Element type: event, command, actor, aggregate, policy, "
            + "read_model, external_system, hotspot", converter = Converters.ElementTypeConverter.class)
    private ElementType type;

    @Parameters(index = "2", description = "Element name")
    private String name;

    @Option(names = "--position", description = "Timeline position (default: next free slot for the type)")
    private Integer position;

    @Option(names = "--notes", description = "Free-text notes")
    private String notes;

    @Option(names = "--created-by", description = "Author of the element")
    private String createdBy;

    @Option(names = "--triggers", split = ",", description = "Comma-separated ids of elements this one triggers")
    private List<String> triggers;

    @Option(names = "--triggered-by", split = ",", description = "Comma-separated ids of elements that trigger this one")
    private List<String> triggeredBy;

    @Option(names = "--context", description = "Bounded context ID")
    private String contextId;

    public AddCommand(WorkshopService service, RendererRegistry renderers) {
        super(service, renderers);
    }

    @Override
    protected int execute(WorkshopRenderer renderer) {
        var draft = new ElementDraft(type, name, position, notes, createdBy, ids(triggers), ids(triggeredBy), contextId);
        return emit(service.addElement(workshopId, draft), renderer);
    }
}
