package com.micaixbrl.core.generator;

import com.micaixbrl.core.model.WhitepaperData;
import com.micaixbrl.core.taxonomy.EnumerationCatalog;
import com.micaixbrl.core.taxonomy.EnumerationMapping;
import com.micaixbrl.core.taxonomy.FieldCatalog;
import com.micaixbrl.core.taxonomy.FieldDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Second build phase: fills elements the typed phase left unset from the raw-field bag.
 *
 * <p>An element already present in the fact map is never touched. Dimensional fields are
 * skipped; they repeat per sub-record and have no single raw value.</p>
 */
final class RawFieldMapper {

    private static final Logger log = LoggerFactory.getLogger(RawFieldMapper.class);

    private final String defaultCurrency;

    RawFieldMapper(String defaultCurrency) {
        this.defaultCurrency = defaultCurrency;
    }

    void map(WhitepaperData data, FactMapWriter writer) {
        if (data.rawFields().isEmpty()) {
            return;
        }
        String recordCurrency = data.partE() != null ? data.partE().tokenPriceCurrency() : null;
        for (FieldDefinition field : FieldCatalog.all()) {
            if (field.dimensional() || writer.contains(field.element())) {
                continue;
            }
            String raw = rawValueFor(field, data);
            if (raw == null || raw.isBlank()) {
                continue;
            }
            mapField(field, raw, recordCurrency, writer);
        }
    }

    /**
     * Raw content for a field: its own number, or for a lettered sub-field the parent
     * number when no other field definition owns it.
     */
    static String rawValueFor(FieldDefinition field, WhitepaperData data) {
        String raw = data.rawField(field.number());
        if (raw != null) {
            return raw;
        }
        Optional<String> parent = field.parentNumber();
        if (parent.isPresent() && !FieldCatalog.isDefined(parent.get())) {
            return data.rawField(parent.get());
        }
        return null;
    }

    private void mapField(FieldDefinition field, String raw, String recordCurrency, FactMapWriter writer) {
        String element = field.element();
        if (field.dataType().isNumeric()) {
            String token = NumericValueExtractor.extract(raw);
            if (token.isEmpty()) {
                log.debug("No numeric token in {} ({}), keeping narrative", field.number(), element);
                writer.text(element, raw);
                return;
            }
            String currency = NumericValueExtractor.detectCurrency(raw)
                .orElse(recordCurrency != null && !recordCurrency.isBlank() ? recordCurrency : defaultCurrency);
            Optional<String> unit = Units.unitFor(field.dataType(), element, currency);
            if (unit.isEmpty()) {
                writer.text(element, raw);
                return;
            }
            writer.numeric(element, token, unit.get(), Units.defaultDecimals(field.dataType()));
            return;
        }
        switch (field.dataType()) {
            case BOOLEAN -> writer.text(element, normalizeBoolean(raw));
            case ENUMERATION -> mapEnumeration(field, raw, writer);
            default -> writer.text(element, raw);
        }
    }

    private void mapEnumeration(FieldDefinition field, String raw, FactMapWriter writer) {
        String element = field.element();
        Optional<EnumerationMapping> resolved = EnumerationCatalog.resolve(element, raw);
        if (resolved.isEmpty() && EnumerationCatalog.isCountryEnumeration(element)) {
            resolved = CountryCodeExtractor.extract(raw);
        }
        if (resolved.isPresent()) {
            writer.enumeration(element, resolved.get());
        } else {
            log.debug("Enumeration value '{}' for {} has no taxonomy member, rendering as text", raw, element);
            writer.text(element, raw);
        }
    }

    static String normalizeBoolean(String raw) {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.equals("yes") || value.equals("true")) {
            return "true";
        }
        if (value.equals("no") || value.equals("false")) {
            return "false";
        }
        return raw;
    }
}
