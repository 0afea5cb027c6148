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
 * CLI command: eventstorming search &lt;workshop-id&gt; &lt;query&gt;
 * <p>
 * Case-insensitive substring match on element names and notes.
 */
@Command(name = "search", mixinStandardHelpOptions = true, description = "Search elements by name or notes")
@Component
public class SearchCommand extends WorkshopCommandSupport {

    @Parameters(index = "0", description = "Workshop ID")
    private String workshopId;

    @Parameters(index = "1", description = "Text to look for")
    private String query;

    @Option(names = "--type", description = "Only elements of this type", converter = Converters.ElementTypeConverter.class)
    private ElementType type;

    @Option(names = "--context", description = "Only elements in this bounded context")
    private String contextId;

    @Mixin
    private PagingOptions paging = new PagingOptions();

    public SearchCommand(WorkshopService service, RendererRegistry renderers) {
        super(service, renderers);
    }

    @Override
    protected int execute(WorkshopRenderer renderer) {
        var page = service.search(workshopId, query, new ElementFilter(type, contextId), paging.pageRequest());
        return print(renderer.search(query, page, paging.detail()));
    }
}
