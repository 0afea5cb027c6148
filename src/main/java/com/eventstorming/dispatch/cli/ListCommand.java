package com.eventstorming.dispatch.cli;

import com.eventstorming.core.service.WorkshopService;
import com.eventstorming.dispatch.render.RendererRegistry;
import com.eventstorming.dispatch.render.WorkshopRenderer;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: eventstorming list
 * <p>
 * Lists stored workshops, most recently updated first.
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "List workshops")
@Component
public class ListCommand extends WorkshopCommandSupport {

    public ListCommand(WorkshopService service, RendererRegistry renderers) {
        super(service, renderers);
    }

    @Override
    protected int execute(WorkshopRenderer renderer) {
        return print(renderer.workshopList(service.listWorkshops()));
    }
}
