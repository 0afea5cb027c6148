package com.eventstorming.dispatch.cli;

import com.eventstorming.core.service.WorkshopService;
import com.eventstorming.dispatch.render.RendererRegistry;
import com.eventstorming.dispatch.render.WorkshopRenderer;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: eventstorming context &lt;workshop-id&gt; &lt;name&gt;
 */
@Command(name = "context", mixinStandardHelpOptions = true, description = "Create a bounded context")
@Component
public class ContextCommand extends WorkshopCommandSupport {

    @Parameters(index = "0", description = "Workshop ID")
    private String workshopId;

    @Parameters(index = "1", description = "Context name")
    private String name;

    @Option(names = "--description", description = "Context description", defaultValue = "")
    private String description;

    @Option(names = "--color", description = "Display color")
    private String color;

    public ContextCommand(WorkshopService service, RendererRegistry renderers) {
        super(service, renderers);
    }

    @Override
    protected int execute(WorkshopRenderer renderer) {
        return emit(service.createBoundedContext(workshopId, name, description, color), renderer);
    }
}
