package in.matchbot.domain.conversation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Choice set attached to an outbound message, laid out in rows.
 */
public record Keyboard(List<List<MenuOption>> rows) {

    private static final Keyboard NONE = new Keyboard(List.of());

    public Keyboard {
        List<List<MenuOption>> copy = new ArrayList<>();
        if (rows != null) {
            for (List<MenuOption> row : rows) {
                if (row != null && !row.isEmpty()) {
                    copy.add(List.copyOf(row));
                }
            }
        }
        rows = List.copyOf(copy);
    }

    public static Keyboard none() {
        return NONE;
    }

    /**
     * One option per row.
     */
    public static Keyboard column(MenuOption... options) {
        List<List<MenuOption>> rows = new ArrayList<>();
        for (MenuOption option : options) {
            rows.add(List.of(option));
        }
        return new Keyboard(rows);
    }

    @SafeVarargs
    public static Keyboard rows(List<MenuOption>... rows) {
        return new Keyboard(Arrays.asList(rows));
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<MenuOption> options() {
        return rows.stream().flatMap(List::stream).toList();
    }

    public boolean contains(MenuOption option) {
        return options().contains(option);
    }
}
