package com.eventstorming.dispatch.cli;

import com.eventstorming.core.service.WorkshopService;
import com.eventstorming.dispatch.render.RendererRegistry;
import com.eventstorming.dispatch.render.WorkshopRenderer;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: eventstorming contexts &lt;workshop-id&gt;
 */
@Command(name = "contexts", mixinStandardHelpOptions = true,
        description = "Show bounded contexts with their members and type breakdown")
@Component
public class ContextsCommand extends WorkshopCommandSupport {

    @Parameters(index = "0", description = "Workshop ID")
    private String workshopId;

    @Option(names = "--context", description = "Show only this bounded context")
    private String contextId;

    @Mixin
    private PagingOptions paging = new PagingOptions();

    public ContextsCommand(WorkshopService service, RendererRegistry renderers) {
        super(service, renderers);
    }

    @Override
    protected int execute(WorkshopRenderer renderer) {
        return print(renderer.contexts(service.contextOverview(workshopId, contextId, paging.pageRequest()),
                paging.detail()));
    }
}
