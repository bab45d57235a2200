package com.example.crosswalk.service;

import com.example.crosswalk.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * Rebuilds the Function → Category → Control hierarchy from a flattened, merged-cell worksheet.
 * <p>
 * Rows arrive in document order. A non-empty cell opens a new node at its level; an empty cell
 * means the row still belongs to the most recently opened node of that level. The build is a single
 * fold over the rows with an {@link Accumulator} holding the open function and category.
 * <p>
 * A category or subcategory arriving with no open parent, or a subcategory whose id already exists,
 * is dropped rather than raising. Drops are logged and returned in {@link CatalogBuildResult#droppedRows()}.
 */
@Service
public class CatalogBuilder {

    private static final Logger log = LoggerFactory.getLogger(CatalogBuilder.class);

    private final ControlIdCanonicalizer canonicalizer;
    private final Clock clock;

    public CatalogBuilder(ControlIdCanonicalizer canonicalizer, Clock clock) {
        this.canonicalizer = canonicalizer;
        this.clock = clock;
    }

    public CatalogBuildResult build(List<ControlRow> rows, CatalogOptions options) {
        log.info("CatalogBuilder: building '{}' from {} rows", options.title(), rows.size());

        Accumulator acc = new Accumulator(options.groupIdStyle());
        for (ControlRow row : rows) {
            acc.accept(row);
        }

        Catalog catalog = new Catalog(
                UUID.randomUUID().toString(),
                new CatalogMetadata(options.title(), Instant.now(clock).truncatedTo(ChronoUnit.MILLIS),
                        options.version(), options.oscalVersion()),
                acc.freeze()
        );

        if (!acc.dropped.isEmpty()) {
            log.warn("CatalogBuilder: {} row(s) dropped because no parent was open or the id was duplicated",
                    acc.dropped.size());
        }
        log.info("CatalogBuilder: {} functions, {} categories, {} controls",
                catalog.groups().size(), acc.categoryCount, acc.controlIds.size());

        return new CatalogBuildResult(catalog, List.copyOf(acc.dropped));
    }

    /**
     * Splits subcategory text on the first colon: {@code GV.OC-01: The mission ...} gives title
     * {@code GV.OC-01} and prose {@code The mission ...}.
     */
    Control toControl(String subcategory, String examples) {
        String id = canonicalizer.canonicalize(subcategory, NotationKind.DOTTED_HIERARCHY);
        int colon = subcategory.indexOf(':');
        String title = (colon >= 0 ? subcategory.substring(0, colon) : subcategory).trim();
        String prose = colon >= 0 ? subcategory.substring(colon + 1).trim() : "";

        List<ControlPart> parts = new ArrayList<>(2);
        parts.add(ControlPart.statement(id, prose));
        if (!isBlank(examples)) {
            parts.add(ControlPart.example(id, examples.trim()));
        }
        return new Control(id, title, List.copyOf(parts));
    }

    private static boolean isBlank(String cell) {
        return cell == null || cell.isBlank();
    }

    /**
     * Carry-forward state of one build: the open function and category. Local to a single call.
     */
    private final class Accumulator {

        private final NotationKind groupIdStyle;
        private final List<FunctionGroup> functions = new ArrayList<>();
        private final List<DroppedRow> dropped = new ArrayList<>();
        private final Set<String> controlIds = new HashSet<>();
        private FunctionGroup currentFunction;
        private CategoryGroup currentCategory;
        private int categoryCount;

        private Accumulator(NotationKind groupIdStyle) {
            this.groupIdStyle = groupIdStyle;
        }

        void accept(ControlRow row) {
            if (!isBlank(row.function())) {
                String text = row.function().trim();
                currentFunction = new FunctionGroup(canonicalizer.canonicalize(text, groupIdStyle), text, new ArrayList<>());
                functions.add(currentFunction);
            }

            if (!isBlank(row.category())) {
                String text = row.category().trim();
                if (currentFunction == null) {
                    drop(row, "category", text, "no open function");
                } else {
                    currentCategory = new CategoryGroup(canonicalizer.canonicalize(text, groupIdStyle), text, new ArrayList<>());
                    currentFunction.categories().add(currentCategory);
                    categoryCount++;
                }
            }

            if (!isBlank(row.subcategory())) {
                String text = row.subcategory().trim();
                if (currentCategory == null) {
                    drop(row, "subcategory", text, "no open category");
                    return;
                }
                Control control = toControl(text, row.examples());
                if (!controlIds.add(control.id())) {
                    drop(row, "subcategory", text, "duplicate control id " + control.id());
                    return;
                }
                currentCategory.controls().add(control);
            }
        }

        private void drop(ControlRow row, String level, String text, String reason) {
            log.warn("CatalogBuilder: dropping {} at row {} ({}): {}", level, row.rowNumber(), reason, text);
            dropped.add(new DroppedRow(row.rowNumber(), level, text, reason));
        }

        /** Immutable copy of the tree once every row has been folded in. */
        List<FunctionGroup> freeze() {
            return functions.stream()
                    .map(f -> new FunctionGroup(f.id(), f.title(), f.categories().stream()
                            .map(c -> new CategoryGroup(c.id(), c.title(), List.copyOf(c.controls())))
                            .toList()))
                    .toList();
        }
    }
}
