package fr.lapetina.congress.gateway.domain.validation;

import fr.lapetina.congress.gateway.domain.exception.CongressApiException;
import fr.lapetina.congress.gateway.domain.model.AmendmentType;
import fr.lapetina.congress.gateway.domain.model.BillType;
import fr.lapetina.congress.gateway.domain.model.Chamber;
import fr.lapetina.congress.gateway.domain.model.LawType;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Field validators shared by every identifier family.
 *
 * <p>Each method takes the raw segment text and either returns the normalized value or throws
 * {@link CongressApiException} of kind {@code INVALID_PARAMETER} naming the field and the
 * violated constraint. Instances are immutable; the only state is the configured bounds.
 *
 * <h2>Bounds</h2>
 * <ul>
 *   <li>congress: {@code [minCongress, maxCongress]}, 93 and 118 by default, both inclusive</li>
 *   <li>district: {@code [0, maxDistrict]}, 53 by default, 0 meaning at-large</li>
 *   <li>calendar year: {@code [1900, 2100]}</li>
 * </ul>
 */
public final class ParameterValidator {

    public static final int DEFAULT_MIN_CONGRESS = 93;
    public static final int DEFAULT_MAX_CONGRESS = 118;
    public static final int DEFAULT_MAX_DISTRICT = 53;

    private static final int MIN_YEAR = 1900;
    private static final int MAX_YEAR = 2100;
    public static final int MAX_PAGE_LIMIT = 250;

    private static final Pattern DIGITS = Pattern.compile("^\\d+$");
    private static final Pattern BIOGUIDE = Pattern.compile("^[A-Z]\\d{6}$");
    private static final Pattern COMMITTEE_CODE = Pattern.compile("^[a-z]{2,4}[0-9]{2}$");
    private static final Pattern TREATY_SUFFIX = Pattern.compile("^[A-Za-z]{1,2}$");
    private static final Pattern CRS_REPORT = Pattern.compile("^[A-Za-z]{1,4}\\d{1,6}$");

    private static final Set<String> REPORT_TYPES = Set.of("hrpt", "srpt", "erpt");
    private static final Set<String> COMMUNICATION_TYPES = Set.of("ec", "ml", "pm", "pt");

    private static final ParameterValidator DEFAULTS =
            new ParameterValidator(DEFAULT_MIN_CONGRESS, DEFAULT_MAX_CONGRESS, DEFAULT_MAX_DISTRICT);

    private final int minCongress;
    private final int maxCongress;
    private final int maxDistrict;

    public ParameterValidator(int minCongress, int maxCongress, int maxDistrict) {
        if (minCongress < 1 || maxCongress < minCongress) {
            throw new IllegalArgumentException(
                    "Invalid congress range: " + minCongress + ".." + maxCongress);
        }
        if (maxDistrict < 0) {
            throw new IllegalArgumentException("Max district must be >= 0: " + maxDistrict);
        }
        this.minCongress = minCongress;
        this.maxCongress = maxCongress;
        this.maxDistrict = maxDistrict;
    }

    public static ParameterValidator defaults() {
        return DEFAULTS;
    }

    public int getMinCongress() { return minCongress; }
    public int getMaxCongress() { return maxCongress; }
    public int getMaxDistrict() { return maxDistrict; }

    // ==================== CONGRESS ====================

    /**
     * Congress number restricted to the configured range.
     */
    public int congress(String raw) {
        String message = "Invalid congress number: " + raw + ". Must be between "
                + minCongress + " and " + maxCongress;
        int value = parseDigits(raw, message);
        if (value < minCongress || value > maxCongress) {
            throw CongressApiException.invalidParameter(message);
        }
        return value;
    }

    /**
     * Congress number with no upper bound, for the congress overview resource.
     */
    public int anyCongress(String raw) {
        return positiveNumber("congress number", raw);
    }

    // ==================== MEMBERS ====================

    public String stateCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw CongressApiException.invalidParameter("State code is required");
        }
        if (!StateCodes.isValid(raw)) {
            throw CongressApiException.invalidParameter(
                    "Invalid state code: " + raw + ". Must be a valid 2-letter state or territory code");
        }
        return raw.toUpperCase(Locale.ROOT);
    }

    public int district(String raw) {
        String message = "Invalid district number: " + raw + ". Must be an integer between 0 and "
                + maxDistrict + " (0 for at-large)";
        if (raw == null || raw.isBlank()) {
            throw CongressApiException.invalidParameter("District is required");
        }
        int value = parseDigits(raw, message);
        if (value > maxDistrict) {
            throw CongressApiException.invalidParameter(message);
        }
        return value;
    }

    /**
     * Exactly one uppercase letter followed by six digits. Case is not folded here;
     * identifier routes upper-case the segment before calling this.
     */
    public String bioguideId(String raw) {
        if (raw == null || raw.isBlank()) {
            throw CongressApiException.invalidParameter("Bioguide ID is required");
        }
        if (!BIOGUIDE.matcher(raw).matches()) {
            throw CongressApiException.invalidParameter(
                    "Invalid bioguide ID: " + raw + ". Must be one uppercase letter followed by six digits (e.g., \"A000370\")");
        }
        return raw;
    }

    // ==================== COMMITTEES ====================

    public Chamber chamber(String raw) {
        return Chamber.fromCode(raw).orElseThrow(() -> CongressApiException.invalidParameter(
                "Invalid chamber: " + raw + ". Must be 'house' or 'senate'"));
    }

    public String committeeCode(String raw) {
        String normalized = raw == null ? "" : raw.toLowerCase(Locale.ROOT);
        if (!COMMITTEE_CODE.matcher(normalized).matches()) {
            throw CongressApiException.invalidParameter(
                    "Invalid committee code: " + raw + ". Must be 2-4 letters followed by 2 digits (e.g., \"hsag00\")");
        }
        return normalized;
    }

    public String reportType(String raw) {
        return oneOf("report type", raw, REPORT_TYPES);
    }

    // ==================== TYPE CODES ====================

    public BillType billType(String raw) {
        return BillType.fromCode(raw).orElseThrow(() -> CongressApiException.invalidParameter(
                "Invalid bill type: " + raw + ". Must be one of: " + Arrays.stream(BillType.values())
                        .map(BillType::getCode)
                        .collect(Collectors.joining(", "))));
    }

    public AmendmentType amendmentType(String raw) {
        return AmendmentType.fromCode(raw).orElseThrow(() -> CongressApiException.invalidParameter(
                "Invalid amendment type: " + raw + ". Must be one of: hamdt, samdt"));
    }

    public LawType lawType(String raw) {
        return LawType.fromCode(raw).orElseThrow(() -> CongressApiException.invalidParameter(
                "Invalid law type: " + raw + ". Must be 'public' or 'private' (or pub, priv)"));
    }

    public String communicationType(String raw) {
        return oneOf("communication type", raw, COMMUNICATION_TYPES);
    }

    public String treatySuffix(String raw) {
        if (raw == null || !TREATY_SUFFIX.matcher(raw).matches()) {
            throw CongressApiException.invalidParameter(
                    "Invalid treaty suffix: " + raw + ". Must be 1-2 letters (e.g., \"A\")");
        }
        return raw.toUpperCase(Locale.ROOT);
    }

    public String crsReportNumber(String raw) {
        if (raw == null || !CRS_REPORT.matcher(raw).matches()) {
            throw CongressApiException.invalidParameter(
                    "Invalid CRS report number: " + raw + ". Must be a letter prefix followed by digits (e.g., \"R47175\")");
        }
        return raw.toUpperCase(Locale.ROOT);
    }

    public int session(String raw) {
        String message = "Invalid session number: " + raw + ". Must be 1 or 2";
        int value = parseDigits(raw, message);
        if (value != 1 && value != 2) {
            throw CongressApiException.invalidParameter(message);
        }
        return value;
    }

    // ==================== NUMBERS AND DATES ====================

    /**
     * Integer {@code >= 1}. {@code field} is used verbatim in the message.
     */
    public int positiveNumber(String field, String raw) {
        String message = "Invalid " + field + ": " + raw + ". Must be a positive integer";
        int value = parseDigits(raw, message);
        if (value < 1) {
            throw CongressApiException.invalidParameter(message);
        }
        return value;
    }

    /**
     * Year in [1900, 2100], month in [1, 12], day in [1, 31], and the triple must be a real date.
     */
    public LocalDate calendarDate(String rawYear, String rawMonth, String rawDay) {
        String label = rawYear + "-" + rawMonth + "-" + rawDay;
        int year = parseDigits(rawYear, "Invalid date: " + label + ". Year must be numeric");
        int month = parseDigits(rawMonth, "Invalid date: " + label + ". Month must be numeric");
        int day = parseDigits(rawDay, "Invalid date: " + label + ". Day must be numeric");

        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw CongressApiException.invalidParameter(
                    "Invalid date: " + label + ". Year must be between " + MIN_YEAR + " and " + MAX_YEAR);
        }
        if (month < 1 || month > 12) {
            throw CongressApiException.invalidParameter(
                    "Invalid date: " + label + ". Month must be between 1 and 12");
        }
        if (day < 1 || day > 31) {
            throw CongressApiException.invalidParameter(
                    "Invalid date: " + label + ". Day must be between 1 and 31");
        }
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            throw CongressApiException.invalidParameter(
                    "Invalid date: " + label + " is not a valid calendar date");
        }
    }

    // ==================== PAGING ====================

    /**
     * Page size in [1, 250]; null means the upstream default.
     */
    public Integer pageLimit(Integer limit) {
        if (limit != null && (limit < 1 || limit > MAX_PAGE_LIMIT)) {
            throw CongressApiException.invalidParameter(
                    "Invalid limit: " + limit + ". Must be between 1 and " + MAX_PAGE_LIMIT);
        }
        return limit;
    }

    /**
     * Page offset {@code >= 0}; null means the upstream default.
     */
    public Integer pageOffset(Integer offset) {
        if (offset != null && offset < 0) {
            throw CongressApiException.invalidParameter(
                    "Invalid offset: " + offset + ". Must be a non-negative integer");
        }
        return offset;
    }

    // ==================== HELPERS ====================

    private static int parseDigits(String raw, String message) {
        if (raw == null || !DIGITS.matcher(raw).matches()) {
            throw CongressApiException.invalidParameter(message);
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw CongressApiException.invalidParameter(message);
        }
    }

    private static String oneOf(String field, String raw, Set<String> allowed) {
        String normalized = raw == null ? "" : raw.toLowerCase(Locale.ROOT);
        if (!allowed.contains(normalized)) {
            throw CongressApiException.invalidParameter(
                    "Invalid " + field + ": " + raw + ". Must be one of: "
                            + allowed.stream().sorted().collect(Collectors.joining(", ")));
        }
        return normalized;
    }
}
