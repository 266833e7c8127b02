package io.mydata.core.schema;

/** Name conversions shared by kind resolution, container defaults and schema lookups. */
public final class KindNames {

    private KindNames() {}

    /**
     * Converts an attribute name to the kind name it refers to: {@code line_item} → {@code LineItem},
     * {@code invoiceHeader} → {@code InvoiceHeader}.
     */
    public static String camelize(String name) {
        StringBuilder out = new StringBuilder(name.length());
        boolean upperNext = true;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_' || c == '-' || c == ' ') {
                upperNext = true;
            } else if (upperNext) {
                out.append(Character.toUpperCase(c));
                upperNext = false;
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    /** The last segment of a qualified kind name ({@code ::}, {@code .} or {@code $} separated). */
    public static String shortName(String kindName) {
        String name = kindName;
        int idx = name.lastIndexOf("::");
        if (idx >= 0) {
            name = name.substring(idx + 2);
        }
        idx = Math.max(name.lastIndexOf('.'), name.lastIndexOf('$'));
        return idx >= 0 ? name.substring(idx + 1) : name;
    }

    /**
     * The qualifier of a kind name including its trailing separator: {@code MyData::Resources::Node}
     * → {@code MyData::Resources::}. Empty for an unqualified name.
     */
    public static String namespace(String kindName) {
        return kindName.substring(0, kindName.length() - shortName(kindName).length());
    }
}
