package com.eventstorming.dispatch.cli;

import com.eventstorming.core.model.DetailLevel;
import com.eventstorming.core.query.PageRequest;
import picocli.CommandLine.Option;

/**
 * Page and detail options for listing commands.
 */
public class PagingOptions {

    @Option(names = {"--page", "-p"}, description = "Page number, starting at 1", defaultValue = "1")
    int page = 1;

    @Option(names = {"--page-size"}, description = "Items per page, 1..200 (default: ${DEFAULT-VALUE})",
            defaultValue = "50")
    int pageSize = PageRequest.DEFAULT_PAGE_SIZE;

    @Option(names = {"--detail", "-d"}, description = "Detail level: summary or full (default: ${DEFAULT-VALUE})",
            defaultValue = "summary", converter = Converters.DetailLevelConverter.class)
    DetailLevel detail = DetailLevel.SUMMARY;

    public PageRequest pageRequest() {
        return new PageRequest(page, pageSize);
    }

    public DetailLevel detail() {
        return detail;
    }
}
