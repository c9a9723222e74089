package com.example.CommonSupplier.logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sheet names of the supplier master pre-file, exactly as the Fiori export writes them.
 */
public final class SheetNames {

    public static final String GENERAL = "BUT000 - General";
    public static final String ROLE = "BUT100 - Role";
    public static final String ADDRESS = "ADRC - Address";
    public static final String SUPPLIER_GENERAL = "LFA1 - Supplier General";
    public static final String COMPANY_CODE = "LFB1 - Company Code (Supplier)";
    public static final String PURCHASING_ORG = "LFM1 - Purchasing Org Data";
    // Excel caps sheet names at 31 characters, hence the cut
    public static final String PARTNER_FUNCTION = "WYT3 - Partner Function (Suppli";

    public static final List<String> REQUIRED = List.of(
            GENERAL, ROLE, ADDRESS, SUPPLIER_GENERAL, COMPANY_CODE
    );

    public static final List<String> OPTIONAL = List.of(PURCHASING_ORG, PARTNER_FUNCTION);

    public static final String SOURCE_ID = "Source_ID";

    private SheetNames() {
    }

    public static List<String> allowList() {
        List<String> all = new ArrayList<>(REQUIRED);
        all.addAll(OPTIONAL);
        return Collections.unmodifiableList(all);
    }
}
