package fr.lapetina.congress.gateway.domain.validation;

import fr.lapetina.congress.gateway.domain.exception.CongressApiException;
import fr.lapetina.congress.gateway.domain.model.AmendmentType;
import fr.lapetina.congress.gateway.domain.model.BillType;
import fr.lapetina.congress.gateway.domain.model.Chamber;
import fr.lapetina.congress.gateway.domain.model.ErrorKind;
import fr.lapetina.congress.gateway.domain.model.LawType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParameterValidatorTest {

    private ParameterValidator validator;

    @BeforeEach
    void setUp() {
        validator = ParameterValidator.defaults();
    }

    @Nested
    @DisplayName("Congress number")
    class CongressNumber {

        @Test
        @DisplayName("should accept both ends of the supported range")
        void shouldAcceptBounds() {
            assertThat(validator.congress("93")).isEqualTo(93);
            assertThat(validator.congress("118")).isEqualTo(118);
        }

        @Test
        @DisplayName("should reject congress below the range with the range in the message")
        void shouldRejectBelowRange() {
            assertThatThrownBy(() -> validator.congress("50"))
                    .isInstanceOf(CongressApiException.class)
                    .hasMessage("Invalid congress number: 50. Must be between 93 and 118")
                    .extracting(e -> ((CongressApiException) e).getKind())
                    .isEqualTo(ErrorKind.INVALID_PARAMETER);
        }

        @ParameterizedTest
        @ValueSource(strings = {"119", "abc", "-1", "", "11.5"})
        @DisplayName("should reject out-of-range or non-numeric congress")
        void shouldRejectInvalid(String raw) {
            assertThatThrownBy(() -> validator.congress(raw))
                    .isInstanceOf(CongressApiException.class)
                    .hasMessageStartingWith("Invalid congress number");
        }

        @Test
        @DisplayName("should honour configured bounds")
        void shouldHonourConfiguredBounds() {
            ParameterValidator wide = new ParameterValidator(80, 119, 53);

            assertThat(wide.congress("119")).isEqualTo(119);
            assertThatThrownBy(() -> wide.congress("79"))
                    .hasMessageContaining("80 and 119");
        }

        @Test
        @DisplayName("should accept any positive congress for the overview resource")
        void shouldAcceptAnyPositiveCongress() {
            assertThat(validator.anyCongress("1")).isEqualTo(1);
            assertThatThrownBy(() -> validator.anyCongress("0"))
                    .hasMessage("Invalid congress number: 0. Must be a positive integer");
        }
    }

    @Nested
    @DisplayName("Member fields")
    class MemberFields {

        @Test
        @DisplayName("should normalize state codes to upper case")
        void shouldNormalizeStateCode() {
            assertThat(validator.stateCode("ca")).isEqualTo("CA");
            assertThat(validator.stateCode("PR")).isEqualTo("PR");
        }

        @Test
        @DisplayName("should accept all 56 state and territory codes in either case")
        void shouldAcceptEveryStateCode() {
            assertThat(StateCodes.all())
                    .hasSize(56)
                    .contains("DC", "PR", "VI", "GU", "AS", "MP");

            for (String code : StateCodes.all()) {
                assertThat(validator.stateCode(code)).isEqualTo(code);
                assertThat(validator.stateCode(code.toLowerCase(Locale.ROOT))).isEqualTo(code);
            }
        }

        @Test
        @DisplayName("should reject unknown state codes")
        void shouldRejectUnknownStateCode() {
            assertThatThrownBy(() -> validator.stateCode("XX"))
                    .isInstanceOf(CongressApiException.class)
                    .hasMessage("Invalid state code: XX. Must be a valid 2-letter state or territory code");
        }

        @Test
        @DisplayName("should accept at-large and maximum districts")
        void shouldAcceptDistrictBounds() {
            assertThat(validator.district("0")).isZero();
            assertThat(validator.district("53")).isEqualTo(53);
        }

        @ParameterizedTest
        @ValueSource(strings = {"54", "-1", "x1"})
        @DisplayName("should reject districts outside 0..53")
        void shouldRejectDistrict(String raw) {
            assertThatThrownBy(() -> validator.district(raw))
                    .hasMessageContaining("Must be an integer between 0 and 53");
        }

        @Test
        @DisplayName("should accept a well formed bioguide id")
        void shouldAcceptBioguideId() {
            assertThat(validator.bioguideId("P000197")).isEqualTo("P000197");
        }

        @ParameterizedTest
        @ValueSource(strings = {"p000197", "P00019", "PP00019", "P0001977"})
        @DisplayName("should reject malformed bioguide ids")
        void shouldRejectBioguideId(String raw) {
            assertThatThrownBy(() -> validator.bioguideId(raw))
                    .hasMessageStartingWith("Invalid bioguide ID: " + raw);
        }
    }

    @Nested
    @DisplayName("Type codes")
    class TypeCodes {

        @Test
        @DisplayName("should parse chambers case-insensitively")
        void shouldParseChamber() {
            assertThat(validator.chamber("House")).isEqualTo(Chamber.HOUSE);
            assertThat(validator.chamber("senate")).isEqualTo(Chamber.SENATE);
            assertThatThrownBy(() -> validator.chamber("joint"))
                    .hasMessage("Invalid chamber: joint. Must be 'house' or 'senate'");
        }

        @Test
        @DisplayName("should accept every bill type")
        void shouldAcceptBillTypes() {
            for (BillType type : BillType.values()) {
                assertThat(validator.billType(type.getCode().toUpperCase())).isEqualTo(type);
            }
            assertThatThrownBy(() -> validator.billType("hb"))
                    .hasMessageContaining("Invalid bill type: hb");
        }

        @Test
        @DisplayName("should resolve amendment and law type aliases")
        void shouldResolveAliases() {
            assertThat(validator.amendmentType("h.amdt")).isEqualTo(AmendmentType.HAMDT);
            assertThat(validator.amendmentType("senate-amendment")).isEqualTo(AmendmentType.SAMDT);
            assertThat(validator.lawType("pl")).isEqualTo(LawType.PUBLIC);
            assertThat(validator.lawType("pvt")).isEqualTo(LawType.PRIVATE);
        }

        @Test
        @DisplayName("should validate committee codes")
        void shouldValidateCommitteeCode() {
            assertThat(validator.committeeCode("HSAG00")).isEqualTo("hsag00");
            assertThatThrownBy(() -> validator.committeeCode("hsag0"))
                    .hasMessageStartingWith("Invalid committee code: hsag0");
        }

        @Test
        @DisplayName("should validate report and communication types")
        void shouldValidateReportAndCommunicationTypes() {
            assertThat(validator.reportType("HRPT")).isEqualTo("hrpt");
            assertThat(validator.communicationType("ec")).isEqualTo("ec");
            assertThatThrownBy(() -> validator.reportType("xrpt"))
                    .hasMessage("Invalid report type: xrpt. Must be one of: erpt, hrpt, srpt");
            assertThatThrownBy(() -> validator.communicationType("zz"))
                    .hasMessage("Invalid communication type: zz. Must be one of: ec, ml, pm, pt");
        }

        @Test
        @DisplayName("should only accept sessions 1 and 2")
        void shouldValidateSession() {
            assertThat(validator.session("2")).isEqualTo(2);
            assertThatThrownBy(() -> validator.session("3"))
                    .hasMessage("Invalid session number: 3. Must be 1 or 2");
        }
    }

    @Nested
    @DisplayName("Dates")
    class Dates {

        @Test
        @DisplayName("should build a real calendar date")
        void shouldBuildDate() {
            assertThat(validator.calendarDate("2024", "02", "29")).isEqualTo(LocalDate.of(2024, 2, 29));
        }

        @Test
        @DisplayName("should reject month 13")
        void shouldRejectMonth() {
            assertThatThrownBy(() -> validator.calendarDate("2023", "13", "01"))
                    .isInstanceOf(CongressApiException.class)
                    .hasMessage("Invalid date: 2023-13-01. Month must be between 1 and 12");
        }

        @Test
        @DisplayName("should reject impossible dates")
        void shouldRejectImpossibleDate() {
            assertThatThrownBy(() -> validator.calendarDate("2023", "02", "30"))
                    .hasMessage("Invalid date: 2023-02-30 is not a valid calendar date");
        }

        @Test
        @DisplayName("should reject years outside 1900..2100")
        void shouldRejectYear() {
            assertThatThrownBy(() -> validator.calendarDate("1899", "01", "01"))
                    .hasMessage("Invalid date: 1899-01-01. Year must be between 1900 and 2100");
        }
    }

    @Test
    @DisplayName("should bound page limit and offset")
    void shouldBoundPaging() {
        assertThat(validator.pageLimit(null)).isNull();
        assertThat(validator.pageLimit(250)).isEqualTo(250);
        assertThat(validator.pageOffset(0)).isZero();

        assertThatThrownBy(() -> validator.pageLimit(0)).hasMessageContaining("between 1 and 250");
        assertThatThrownBy(() -> validator.pageLimit(251)).hasMessageContaining("between 1 and 250");
        assertThatThrownBy(() -> validator.pageOffset(-1)).hasMessageContaining("non-negative");
    }

    @Test
    @DisplayName("should reject an inverted congress range at construction")
    void shouldRejectInvertedRange() {
        assertThatThrownBy(() -> new ParameterValidator(118, 93, 53))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
