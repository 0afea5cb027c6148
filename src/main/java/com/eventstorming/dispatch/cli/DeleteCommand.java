package com.eventstorming.dispatch.cli;

import com.eventstorming.core.service.WorkshopService;
import com.eventstorming.dispatch.render.RendererRegistry;
import com.eventstorming.dispatch.render.WorkshopRenderer;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: eventstorming delete &lt;workshop-id&gt; &lt;element-id&gt;
 */
@Command(name = "delete", mixinStandardHelpOptions = true,
        description = "Delete an element and every reference to it")
@Component
public class DeleteCommand extends WorkshopCommandSupport {

    @Parameters(index = "0", description = "Workshop ID")
    private String workshopId;

    @Parameters(index = "1", description = "Element ID")
    private String elementId;

    public DeleteCommand(WorkshopService service, RendererRegistry renderers) {
        super(service, renderers);
    }

    @Override
    protected int execute(WorkshopRenderer renderer) {
        return emit(service.deleteElement(workshopId, elementId), renderer);
    }
}
