package com.eventstorming.dispatch.cli;

import com.eventstorming.core.model.DetailLevel;
import com.eventstorming.core.service.WorkshopService;
import com.eventstorming.dispatch.render.RendererRegistry;
import com.eventstorming.dispatch.render.WorkshopRenderer;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: eventstorming show &lt;workshop-id&gt;
 */
@Command(name = "show", mixinStandardHelpOptions = true, description = "Show a workshop with its elements and contexts")
@Component
public class ShowCommand extends WorkshopCommandSupport {

    @Parameters(index = "0", description = "Workshop ID")
    private String workshopId;

    @Option(names = {"--detail", "-d"}, description = "Detail level: summary or full (default: ${DEFAULT-VALUE})",
            defaultValue = "summary", converter = Converters.DetailLevelConverter.class)
    private DetailLevel detail;

    public ShowCommand(WorkshopService service, RendererRegistry renderers) {
        super(service, renderers);
    }

    @Override
    protected int execute(WorkshopRenderer renderer) {
        return print(renderer.workshop(service.loadWorkshop(workshopId), detail));
    }
}
