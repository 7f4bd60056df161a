package work.lcod.config.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record ListValue(List<ConfigValue> items) implements ConfigValue {
    public ListValue {
        items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public int size() {
        return items.size();
    }

    public ConfigValue get(int index) {
        return items.get(index);
    }

    @Override
    public String typeName() {
        return "list";
    }

    @Override
    public Object toPlain() {
        var plain = new ArrayList<>(items.size());
        for (var item : items) {
            plain.add(item.toPlain());
        }
        return plain;
    }
}
