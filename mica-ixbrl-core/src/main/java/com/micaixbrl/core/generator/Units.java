package com.micaixbrl.core.generator;

import com.micaixbrl.core.taxonomy.MicaTaxonomy;
import com.micaixbrl.core.taxonomy.XbrlDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Currency;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Units known to the generator and the rules choosing one for a numeric fact.
 */
public final class Units {

    private Units() {
        // Utility class
    }

    private static final Logger log = LoggerFactory.getLogger(Units.class);

    public static final String PURE = "unit_pure";
    public static final String KWH = "unit_kWh";
    public static final String TONNES_CO2E = "unit_tCO2e";
    public static final String DEFAULT_CURRENCY = "EUR";

    private static final String CURRENCY_UNIT_PREFIX = "unit_";

    private static final Map<String, XbrlUnit> STANDARD = standardUnits();

    private static final Set<String> ISO_CURRENCIES = Currency.getAvailableCurrencies().stream()
        .map(Currency::getCurrencyCode)
        .collect(Collectors.toUnmodifiableSet());

    /** Elements measured in something other than their data type's default unit. */
    private static final Map<String, String> ELEMENT_UNITS = Map.of(
        MicaTaxonomy.element("EnergyConsumption"), KWH,
        MicaTaxonomy.element("ScopeOneAndTwoGhgEmissions"), TONNES_CO2E
    );

    private static Map<String, XbrlUnit> standardUnits() {
        Map<String, XbrlUnit> units = new LinkedHashMap<>();
        for (String currency : new String[] {"EUR", "USD", "GBP", "CHF"}) {
            units.put(currencyUnitId(currency), new XbrlUnit(currencyUnitId(currency), "iso4217:" + currency));
        }
        units.put(PURE, new XbrlUnit(PURE, "xbrli:pure"));
        units.put(KWH, new XbrlUnit(KWH, "utr:kWh"));
        units.put(TONNES_CO2E, new XbrlUnit(TONNES_CO2E, "utr:t"));
        return Collections.unmodifiableMap(units);
    }

    /**
     * Unit id of a currency; a null or blank currency means the default currency.
     *
     * @param currency ISO 4217 code, may be null
     * @return unit id such as {@code unit_USD}
     */
    public static String currencyUnitId(String currency) {
        return CURRENCY_UNIT_PREFIX + normalizeCurrency(currency);
    }

    private static String normalizeCurrency(String currency) {
        return currency == null || currency.isBlank()
            ? DEFAULT_CURRENCY
            : currency.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Chooses the unit of a numeric fact.
     *
     * @param dataType data type of the element
     * @param element qualified element name
     * @param currency currency for monetary facts
     * @return unit id, or empty for non-numeric types and monetary facts in a non-ISO currency
     */
    public static Optional<String> unitFor(XbrlDataType dataType, String element, String currency) {
        if (!dataType.isNumeric()) {
            return Optional.empty();
        }
        String override = ELEMENT_UNITS.get(element);
        if (override != null) {
            return Optional.of(override);
        }
        if (dataType == XbrlDataType.MONETARY) {
            String code = normalizeCurrency(currency);
            if (!ISO_CURRENCIES.contains(code)) {
                log.warn("Currency '{}' of {} is not an ISO 4217 code, fact cannot carry a monetary unit",
                    code, element);
                return Optional.empty();
            }
            return Optional.of(currencyUnitId(code));
        }
        return Optional.of(PURE);
    }

    /**
     * Default decimal precision per data type.
     *
     * @param dataType data type
     * @return decimals attribute value
     */
    public static int defaultDecimals(XbrlDataType dataType) {
        return dataType == XbrlDataType.INTEGER ? 0 : 2;
    }

    /**
     * Unit definition of an id: the fixed units, or {@code unit_<ISO>} for any ISO 4217 currency.
     *
     * @param unitId unit id
     * @return unit definition, or empty when the id names no known unit
     */
    public static Optional<XbrlUnit> byId(String unitId) {
        XbrlUnit standard = STANDARD.get(unitId);
        if (standard != null) {
            return Optional.of(standard);
        }
        if (unitId != null && unitId.startsWith(CURRENCY_UNIT_PREFIX)) {
            String code = unitId.substring(CURRENCY_UNIT_PREFIX.length());
            if (ISO_CURRENCIES.contains(code)) {
                return Optional.of(new XbrlUnit(unitId, "iso4217:" + code));
            }
        }
        return Optional.empty();
    }
}
