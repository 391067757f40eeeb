package io.github.eutro.nativedec.api;

import io.github.eutro.nativedec.core.arch.Image;
import io.github.eutro.nativedec.core.ir.BasicBlock;
import io.github.eutro.nativedec.core.ir.Function;

/**
 * Picks the names of functions.
 * <p>
 * A function whose entry has an address with a symbol is named after the symbol,
 * cleaned up with {@link #cleanName(String)}. If cleaning changed the name, the
 * symbol is kept in the function's comment, as is its demangled form if that
 * looks like a function signature. A function whose entry has an address but
 * no symbol is named {@code func_<hex address>}. Any other function is named
 * {@code func_noentry_<hex id>}, after the function's unique {@link Function#getId() id}.
 */
public class FunctionNamer {
    private final Image image;

    public FunctionNamer(Image image) {
        this.image = image;
    }

    /**
     * Name a function.
     *
     * @param function The function.
     */
    public void name(Function function) {
        BasicBlock entry = function.getEntry();
        if (entry == null || entry.getAddress() == null) {
            function.setName(String.format("func_noentry_%x", function.getId()));
            return;
        }
        long address = entry.getAddress();
        String symbol = image.getName(address);
        if (symbol == null || symbol.isEmpty()) {
            function.setName(String.format("func_%x", address));
            return;
        }

        String cleanName = cleanName(symbol);
        function.setName(cleanName);
        if (!cleanName.equals(symbol)) {
            function.getComment().add(symbol);
        }
        String demangled = image.getDemangler().demangle(symbol);
        if (demangled != null && demangled.indexOf('(') >= 0) {
            function.getComment().add(demangled);
        }
    }

    /**
     * Turn a symbol name into an identifier: characters other than ASCII letters,
     * digits and {@code _} become {@code _}, and a leading digit is prefixed with {@code _}.
     *
     * @param name The name.
     * @return The identifier, never empty.
     */
    public static String cleanName(String name) {
        if (name.isEmpty()) return "_";
        StringBuilder sb = new StringBuilder(name.length() + 1);
        if (name.charAt(0) >= '0' && name.charAt(0) <= '9') {
            sb.append('_');
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if ((c >= 'a' && c <= 'z')
                    || (c >= 'A' && c <= 'Z')
                    || (c >= '0' && c <= '9')
                    || c == '_') {
                sb.append(c);
            } else {
                sb.append('_');
            }
        }
        return sb.toString();
    }
}
