package com.archlens.core.assembler;

import java.util.List;
import java.util.Locale;

/**
 * Default {@link LayerClassifier} matching substrings of the lower-cased path.
 *
 * <p>Rules are applied in order and later rules override earlier ones:
 * <ol>
 *   <li>Discovery (layer 0, priority 10): scanner, mapping, discovery, search, parser,
 *       bootstrap, physical and main entry points; main files get 5, scanners and
 *       discovery 8.</li>
 *   <li>Reasoning (layer 1, priority 30): router, prompt, engine, logic, reasoning,
 *       processor, inference and Python files other than main; router and prompt get 20,
 *       engine and inference 25.</li>
 *   <li>Action (layer 2, priority 80): rclone, sqlite, db, storage, action, executor,
 *       reporting, ui, enforcement, client; db and sqlite get 70, enforcement and
 *       action 90.</li>
 *   <li>Markdown files are discovery with priority 1.</li>
 * </ol>
 * Anything unmatched is reasoning with priority 50, except Python files, which get 25.
 */
public class FileNameLayerClassifier implements LayerClassifier {

    private static final int DEFAULT_PRIORITY = 50;

    private static final List<String> DISCOVERY_MARKERS = List.of(
        "scanner", "mapping", "discovery", "search", "parser", "bootstrap", "physical",
        "main.rs", "main.ts", "main.py"
    );
    private static final List<String> REASONING_MARKERS = List.of(
        "router", "prompt", "engine", "logic", "reasoning", "processor", "inference"
    );
    private static final List<String> ACTION_MARKERS = List.of(
        "rclone", "sqlite", "db", "storage", "action", "executor", "reporting", "ui",
        "enforcement", "client"
    );

    @Override
    public LayerHint classify(String path) {
        String name = path.toLowerCase(Locale.ROOT);
        boolean python = name.endsWith(".py");
        int layer = LayerHint.REASONING;
        int priority = DEFAULT_PRIORITY;

        if (containsAny(name, DISCOVERY_MARKERS)) {
            layer = LayerHint.DISCOVERY;
            priority = 10;
            if (name.contains("main")) {
                priority = 5;
            }
            if (name.contains("scanner") || name.contains("discovery")) {
                priority = 8;
            }
        }

        if (containsAny(name, REASONING_MARKERS) || (python && !name.contains("main"))) {
            layer = LayerHint.REASONING;
            priority = 30;
            if (name.contains("router") || name.contains("prompt")) {
                priority = 20;
            }
            if (name.contains("engine") || name.contains("inference")) {
                priority = 25;
            }
        }

        if (containsAny(name, ACTION_MARKERS)) {
            layer = LayerHint.ACTION;
            priority = 80;
            if (name.contains("db") || name.contains("sqlite")) {
                priority = 70;
            }
            if (name.contains("enforcement") || name.contains("action")) {
                priority = 90;
            }
        }

        if (name.endsWith(".md")) {
            layer = LayerHint.DISCOVERY;
            priority = 1;
        }

        if (python && layer == LayerHint.REASONING && priority == DEFAULT_PRIORITY) {
            priority = 25;
        }

        return new LayerHint(layer, priority);
    }

    private static boolean containsAny(String name, List<String> markers) {
        return markers.stream().anyMatch(name::contains);
    }
}
