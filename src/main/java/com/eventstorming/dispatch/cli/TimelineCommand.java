package com.eventstorming.dispatch.cli;

import com.eventstorming.core.model.ElementType;
import com.eventstorming.core.query.ElementFilter;
import com.eventstorming.core.service.WorkshopService;
import com.eventstorming.dispatch.render.RendererRegistry;
import com.eventstorming.dispatch.render.WorkshopRenderer;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: eventstorming timeline &lt;workshop-id&gt;
 * <p>
 * Elements ordered by position, ties broken by creation time.
 */
@Command(name = "timeline", mixinStandardHelpOptions = true, description = "Show elements in timeline order")
@Component
public class TimelineCommand extends WorkshopCommandSupport {

    @Parameters(index = "0", description = "Workshop ID")
    private String workshopId;

    @Option(names = "--type", description = "Only elements of this type", converter = Converters.ElementTypeConverter.class)
    private ElementType type;

    @Option(names = "--context", description = "Only elements in this bounded context")
    private String contextId;

    @Mixin
    private PagingOptions paging = new PagingOptions();

    public TimelineCommand(WorkshopService service, RendererRegistry renderers) {
        super(service, renderers);
    }

    @Override
    protected int execute(WorkshopRenderer renderer) {
        var filter = new ElementFilter(type, contextId);
        return print(renderer.timeline(service.timeline(workshopId, filter, paging.pageRequest()), filter,
                paging.detail()));
    }
}
