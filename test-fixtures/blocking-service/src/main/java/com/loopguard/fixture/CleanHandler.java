package com.loopguard.fixture;

import java.util.List;
import java.util.stream.Collectors;

public class CleanHandler {

    private static final int MAX_ITEMS = 100;

    public List<String> firstItems(List<String> items) {
        return items.stream()
                    .limit(MAX_ITEMS)
                    .map(String::trim)
                    .collect(Collectors.toList());
    }
}
