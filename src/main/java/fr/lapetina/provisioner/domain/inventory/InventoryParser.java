package fr.lapetina.provisioner.domain.inventory;

import fr.lapetina.provisioner.domain.event.ProvisioningListener;
import fr.lapetina.provisioner.domain.model.InventoryRecord;
import fr.lapetina.provisioner.domain.model.ParseDiagnostic;
import fr.lapetina.provisioner.domain.model.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Tolerant parser for line-oriented {@code hostname,address} inventories.
 *
 * <p>Each physical line ends up as exactly one of: a record, a diagnostic, or a skip.
 * <ol>
 *   <li>Blank lines are skipped.</li>
 *   <li>Lines whose first field starts with {@code #} are comments and skipped.</li>
 *   <li>With two or more fields, the first two are hostname and address; extras are ignored.</li>
 *   <li>A single field is split once on its first comma (a quoted {@code "host,ip"}); if that
 *       does not give two non-empty parts the line is {@code MALFORMED_LINE}.</li>
 *   <li>An empty hostname or address after trimming drops the line silently, or reports
 *       {@code EMPTY_FIELD} when strict mode is on.</li>
 *   <li>An address that is not an IPv4/IPv6 literal is {@code INVALID_ADDRESS}.</li>
 * </ol>
 *
 * <p>Malformed content never raises. The only failure is the source itself being unreadable,
 * which surfaces as an {@link IOException}.
 */
public final class InventoryParser {

    private static final Logger log = LoggerFactory.getLogger(InventoryParser.class);

    private final ProvisioningListener listener;
    private final boolean diagnoseEmptyFields;

    public InventoryParser(ProvisioningListener listener, boolean diagnoseEmptyFields) {
        this.listener = listener != null ? listener : ProvisioningListener.NOOP;
        this.diagnoseEmptyFields = diagnoseEmptyFields;
    }

    public InventoryParser(ProvisioningListener listener) {
        this(listener, false);
    }

    public InventoryParser() {
        this(ProvisioningListener.NOOP, false);
    }

    /**
     * Parses an inventory file (UTF-8).
     *
     * @throws IOException if the file is missing or cannot be read
     */
    public ParseResult parse(Path path) throws IOException {
        log.debug("Reading inventory: path={}", path);
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    /**
     * Parses inventory text held in memory.
     */
    public ParseResult parse(String text) {
        try {
            return parse(new StringReader(text));
        } catch (IOException e) {
            // StringReader does not fail
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Parses inventory text from a reader. The reader is consumed but not closed.
     *
     * @throws IOException if reading fails
     */
    public ParseResult parse(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered
                ? buffered
                : new BufferedReader(source);

        List<InventoryRecord> records = new ArrayList<>();
        List<ParseDiagnostic> diagnostics = new ArrayList<>();
        int lineNumber = 0;
        int blank = 0;
        int comments = 0;
        int dropped = 0;

        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;

            if (line.isBlank()) {
                blank++;
                continue;
            }

            List<String> fields = InventoryFields.split(line);
            if (fields.size() == 1 && fields.get(0).isBlank()) {
                blank++;
                continue;
            }
            if (fields.get(0).strip().startsWith("#")) {
                comments++;
                continue;
            }

            String hostname;
            String address;
            if (fields.size() >= 2) {
                hostname = fields.get(0).strip();
                address = fields.get(1).strip();
            } else {
                String[] parts = fields.get(0).split(",", 2);
                if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
                    report(diagnostics, ParseDiagnostic.malformedLine(lineNumber, line));
                    continue;
                }
                hostname = parts[0].strip();
                address = parts[1].strip();
            }

            if (hostname.isEmpty() || address.isEmpty()) {
                if (diagnoseEmptyFields) {
                    report(diagnostics, ParseDiagnostic.emptyField(lineNumber, line));
                } else {
                    log.debug("Dropping line with empty field: line={}, raw={}", lineNumber, line);
                    dropped++;
                }
                continue;
            }

            if (!AddressLiterals.isValid(address)) {
                report(diagnostics, ParseDiagnostic.invalidAddress(lineNumber, line, address));
                continue;
            }

            records.add(new InventoryRecord(hostname, address));
        }

        ParseResult result = new ParseResult(records, diagnostics, lineNumber, blank, comments, dropped);
        log.debug("Inventory parsed: lines={}, records={}, diagnostics={}, dropped={}",
                lineNumber, records.size(), diagnostics.size(), dropped);
        notifyParsed(result);
        return result;
    }

    private void report(List<ParseDiagnostic> diagnostics, ParseDiagnostic diagnostic) {
        diagnostics.add(diagnostic);
        try {
            listener.onDiagnostic(diagnostic);
        } catch (Exception e) {
            log.error("Error notifying listener of diagnostic: line={}", diagnostic.lineNumber(), e);
        }
    }

    private void notifyParsed(ParseResult result) {
        try {
            listener.onInventoryParsed(result);
        } catch (Exception e) {
            log.error("Error notifying listener of parsed inventory", e);
        }
    }
}
