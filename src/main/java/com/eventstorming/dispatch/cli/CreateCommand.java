package com.eventstorming.dispatch.cli;

import com.eventstorming.core.service.WorkshopService;
import com.eventstorming.dispatch.render.RendererRegistry;
import com.eventstorming.dispatch.render.WorkshopRenderer;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: eventstorming create &lt;name&gt;
 */
@Command(name = "create", mixinStandardHelpOptions = true, description = "Create a new workshop")
@Component
public class CreateCommand extends WorkshopCommandSupport {

    @Parameters(index = "0", description = "Workshop name")
    private String name;

    @Option(names = "--description", description = "Workshop description", defaultValue = "")
    private String description;

    @Option(names = "--domain", description = "Business domain being modeled", defaultValue = "")
    private String domain;

    @Option(names = "--facilitator", description = "Facilitator name (repeatable)")
    private List<String> facilitators = new ArrayList<>();

    public CreateCommand(WorkshopService service, RendererRegistry renderers) {
        super(service, renderers);
    }

    @Override
    protected int execute(WorkshopRenderer renderer) {
        return emit(service.createWorkshop(name, description, domain, facilitators), renderer);
    }
}
