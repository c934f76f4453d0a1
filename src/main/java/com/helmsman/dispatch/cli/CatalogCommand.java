package com.helmsman.dispatch.cli;

import com.helmsman.core.catalog.PatternCatalog;
import com.helmsman.core.catalog.PatternRule;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: helmsman catalog
 * <p>
 * Lists the loaded pattern catalog: categories in tie-break order with their
 * weights and term counts.
 */
@Command(name = "catalog", mixinStandardHelpOptions = true, description = "Show the loaded pattern catalog")
@Component
public class CatalogCommand implements Runnable {

    @Option(names = {"--terms"}, description = "Also list every term of each rule")
    private boolean showTerms;

    private final PatternCatalog catalog;

    public CatalogCommand(PatternCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        int terms = catalog.rulesByCategory().values().stream()
                .flatMap(List::stream)
                .mapToInt(PatternRule::termCount)
                .sum();
        ConsoleOutput.info("Pattern catalog " + catalog.version()
                + " (" + catalog.ruleCount() + " rules, " + terms + " terms)");
        System.out.println();

        catalog.rulesByCategory().forEach((category, rules) -> {
            for (PatternRule rule : rules) {
                System.out.printf("  %-28s weight %.2f  %d keywords, %d equipment terms, %d indicators%n",
                        category.name(), rule.weight(), rule.keywords().size(),
                        rule.equipmentTerms().size(), rule.priorityIndicators().size());
                if (showTerms) {
                    System.out.println("      keywords:   " + String.join(", ", rule.keywords()));
                    System.out.println("      equipment:  " + String.join(", ", rule.equipmentTerms()));
                    System.out.println("      indicators: " + String.join(", ", rule.priorityIndicators()));
                }
            }
        });
    }
}
