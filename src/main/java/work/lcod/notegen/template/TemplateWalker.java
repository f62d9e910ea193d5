package work.lcod.notegen.template;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Depth-first traversal shared by derivation, resolution and prompt composition.
 *
 * <p>Order per component: each content item, then its list items, then its table cells (all
 * recursively), then the child components.</p>
 */
public final class TemplateWalker {
    private TemplateWalker() {}

    public interface Visitor {
        void visit(Component component, ContentItem item);

        /**
         * Called with the parent before its list items are visited.
         */
        default void beforeListItems(Component component, ContentItem parent) {}
    }

    public static void walk(NoteTemplate template, Visitor visitor) {
        for (var component : template.layout()) {
            walkComponent(component, visitor);
        }
    }

    public static List<ContentItem> collect(NoteTemplate template, Predicate<ContentItem> filter) {
        var out = new ArrayList<ContentItem>();
        walk(template, (component, item) -> {
            if (filter.test(item)) {
                out.add(item);
            }
        });
        return out;
    }

    public static int countModelLeaves(NoteTemplate template) {
        return collect(template, item -> item.slot().isModel() && item.outputPath() != null).size();
    }

    private static void walkComponent(Component component, Visitor visitor) {
        for (var item : component.content()) {
            walkItem(component, item, visitor);
        }
        for (var child : component.children()) {
            walkComponent(child, visitor);
        }
    }

    private static void walkItem(Component component, ContentItem item, Visitor visitor) {
        visitor.visit(component, item);
        if (!item.listItems().isEmpty()) {
            visitor.beforeListItems(component, item);
            for (var nested : item.listItems()) {
                walkItem(component, nested, visitor);
            }
        }
        for (var cell : item.tableMap().values()) {
            walkItem(component, cell, visitor);
        }
    }
}
