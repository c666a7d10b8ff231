package com.emcit.domain.asset;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Free-form technical attributes of an asset (RAM, processor, OS, ...).
 *
 * Captured from a flat field map: anything that is not a standard asset column and carries a
 * non-blank value is kept. Keys are compared without case, '_' or '-', so "serial_number",
 * "serialNumber" and "Serial-Number" are all the same standard column.
 */
public final class TechnicalSpecs {

    static final Set<String> STANDARD_COLUMNS = Set.of(
            "category", "assetname", "brand", "model", "serialnumber", "assettag",
            "location", "quantity", "purchasedate", "invoicedate", "warrantyexpiry",
            "vendorname", "invoicenumber", "baseamount", "gstamount", "department",
            "assignedto", "remarks", "status", "totalamount", "ownership", "assetid"
    );

    private final Map<String, String> values;

    private TechnicalSpecs(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static TechnicalSpecs capture(Map<String, String> fields) {
        TreeMap<String, String> kept = new TreeMap<>();
        if (fields == null) return new TechnicalSpecs(kept);
        for (Map.Entry<String, String> e : fields.entrySet()) {
            String key = e.getKey();
            String value = e.getValue();
            if (key == null || key.isBlank()) continue;
            if (value == null || value.isBlank()) continue;
            if (isStandardColumn(key)) continue;
            kept.put(key.trim(), value.trim());
        }
        return new TechnicalSpecs(kept);
    }

    public static boolean isStandardColumn(String key) {
        return STANDARD_COLUMNS.contains(normalize(key));
    }

    public Map<String, String> asMap() {
        return values;
    }

    private static String normalize(String key) {
        StringBuilder sb = new StringBuilder(key.length());
        for (char c : key.toCharArray()) {
            if (Character.isLetterOrDigit(c)) sb.append(c);
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
