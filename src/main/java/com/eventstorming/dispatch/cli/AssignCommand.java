package com.eventstorming.dispatch.cli;

import com.eventstorming.core.service.WorkshopService;
import com.eventstorming.dispatch.render.RendererRegistry;
import com.eventstorming.dispatch.render.WorkshopRenderer;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: eventstorming assign &lt;workshop-id&gt; &lt;context-id&gt; &lt;element-id&gt;...
 * <p>
 * Unknown element ids are reported but do not fail the command.
 */
@Command(name = "assign", mixinStandardHelpOptions = true, description = "Assign elements to a bounded context")
@Component
public class AssignCommand extends WorkshopCommandSupport {

    @Parameters(index = "0", description = "Workshop ID")
    private String workshopId;

    @Parameters(index = "1", description = "Bounded context ID")
    private String contextId;

    @Parameters(index = "2..*", arity = "1..*", description = "Element IDs")
    private List<String> elementIds;

    public AssignCommand(WorkshopService service, RendererRegistry renderers) {
        super(service, renderers);
    }

    @Override
    protected int execute(WorkshopRenderer renderer) {
        return emit(service.assignToContext(workshopId, contextId, elementIds), renderer);
    }
}
