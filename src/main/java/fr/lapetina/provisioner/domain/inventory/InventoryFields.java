package fr.lapetina.provisioner.domain.inventory;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one inventory line into comma-separated fields.
 *
 * <p>Follows the usual CSV quoting rules on a single physical line: a field that starts with
 * {@code "} is quoted, commas inside it are literal, and {@code ""} inside it is an escaped quote.
 * A quote that does not start a field is kept as-is. An unterminated quoted field runs to the end
 * of the line. Field values are not trimmed.
 */
public final class InventoryFields {

    private static final char DELIMITER = ',';
    private static final char QUOTE = '"';

    private InventoryFields() {
    }

    public static List<String> split(String line) {
        List<String> fields = new ArrayList<>();
        if (line.isEmpty()) {
            return fields;
        }

        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        boolean fieldStart = true;
        int length = line.length();

        for (int i = 0; i < length; i++) {
            char c = line.charAt(i);

            if (quoted) {
                if (c == QUOTE) {
                    if (i + 1 < length && line.charAt(i + 1) == QUOTE) {
                        field.append(QUOTE);
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    field.append(c);
                }
                continue;
            }

            if (c == DELIMITER) {
                fields.add(field.toString());
                field.setLength(0);
                fieldStart = true;
                continue;
            }

            if (c == QUOTE && fieldStart) {
                quoted = true;
            } else {
                field.append(c);
            }
            fieldStart = false;
        }

        fields.add(field.toString());
        return fields;
    }
}
