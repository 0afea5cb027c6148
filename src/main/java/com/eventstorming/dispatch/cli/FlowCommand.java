package com.eventstorming.dispatch.cli;

import com.eventstorming.core.flow.FlowRequest;
import com.eventstorming.core.service.WorkshopService;
import com.eventstorming.dispatch.render.RendererRegistry;
import com.eventstorming.dispatch.render.WorkshopRenderer;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: eventstorming flow &lt;workshop-id&gt;
 * <p>
 * Traces trigger chains from one element, or from every element that
 * nothing triggers.
 */
@Command(name = "flow", mixinStandardHelpOptions = true, description = "Trace event flows along trigger links")
@Component
public class FlowCommand extends WorkshopCommandSupport {

    @Parameters(index = "0", description = "Workshop ID")
    private String workshopId;

    @Option(names = "--start", description = "Element ID to start from (default: all root elements)")
    private String startElementId;

    @Option(names = "--max-depth", description = "Maximum hops from each start, 1..20 (default: ${DEFAULT-VALUE})",
            defaultValue = "5")
    private int maxDepth;

    @Option(names = "--max-elements", description = "Maximum elements shown, 1..500 (default: ${DEFAULT-VALUE})",
            defaultValue = "100")
    private int maxElements;

    public FlowCommand(WorkshopService service, RendererRegistry renderers) {
        super(service, renderers);
    }

    @Override
    protected int execute(WorkshopRenderer renderer) {
        var request = new FlowRequest(startElementId, maxDepth, maxElements);
        return print(renderer.flow(service.traceFlow(workshopId, request)));
    }
}
