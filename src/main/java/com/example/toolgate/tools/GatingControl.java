package com.example.toolgate.tools;

import java.time.Instant;
import java.util.Collection;

public interface GatingControl {

    ToolCatalog catalog();

    GatingSnapshot snapshot();

    EnableOutcome enable(Collection<String> names);

    EnableOutcome enableCategories(Collection<String> categories);

    Instant enableTtl(long minutes);

    void reset();
}
