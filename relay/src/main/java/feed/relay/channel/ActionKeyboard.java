package feed.relay.channel;

import java.util.ArrayList;
import java.util.List;

public record ActionKeyboard(List<List<ActionButton>> rows) {

    public static final ActionKeyboard NONE = new ActionKeyboard(List.of());

    public ActionKeyboard {
        rows = rows.stream().map(List::copyOf).toList();
    }

    /**
     * One button per row.
     */
    public static ActionKeyboard column(List<ActionButton> buttons) {
        List<List<ActionButton>> rows = new ArrayList<>();
        for (ActionButton button : buttons) {
            rows.add(List.of(button));
        }
        return new ActionKeyboard(rows);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<ActionButton> buttons() {
        return rows.stream().flatMap(List::stream).toList();
    }
}
