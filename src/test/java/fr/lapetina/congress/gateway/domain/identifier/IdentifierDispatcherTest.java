package fr.lapetina.congress.gateway.domain.identifier;

import fr.lapetina.congress.gateway.domain.exception.CongressApiException;
import fr.lapetina.congress.gateway.domain.model.AmendmentType;
import fr.lapetina.congress.gateway.domain.model.BillType;
import fr.lapetina.congress.gateway.domain.model.Chamber;
import fr.lapetina.congress.gateway.domain.model.ErrorKind;
import fr.lapetina.congress.gateway.domain.model.LawType;
import fr.lapetina.congress.gateway.domain.model.ResourceCollection;
import fr.lapetina.congress.gateway.domain.model.ResourceRequest;
import fr.lapetina.congress.gateway.domain.validation.ParameterValidator;
import org.assertj.core.api.ThrowableAssert;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class IdentifierDispatcherTest {

    private IdentifierDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new IdentifierDispatcher(ResourceRouteTable.standard(ParameterValidator.defaults()));
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        @Test
        @DisplayName("should resolve a bill sub-resource with typed fields")
        void shouldResolveBillSubResource() {
            ResourceRequest request = dispatcher.resolve("congress-gov://bill/118/hr/1/actions");

            assertThat(request.collection()).isEqualTo(ResourceCollection.BILL);
            assertThat(request.intParam("congress")).isEqualTo(118);
            assertThat(request.param("billType")).isEqualTo(BillType.HR);
            assertThat(request.intParam("billNumber")).isEqualTo(1);
            assertThat(request.subResource()).isEqualTo("actions");
            assertThat(request.endpoint()).isEqualTo("/bill/118/hr/1/actions");
        }

        @Test
        @DisplayName("should normalize case in type codes and sub-resources")
        void shouldNormalizeCase() {
            ResourceRequest request = dispatcher.resolve("congress-gov://bill/118/HR/1/Actions");

            assertThat(request.endpoint()).isEqualTo("/bill/118/hr/1/actions");
            assertThat(request.subResourceName()).contains("actions");
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "congress-gov://bill/118/s/25,                                 /bill/118/s/25",
                "congress-gov://summaries/118/hres,                            /summaries/118/hres",
                "congress-gov://member/p000197,                                /member/P000197",
                "congress-gov://member/P000197/sponsored-legislation,          /member/P000197/sponsored-legislation",
                "congress-gov://member/state/ca,                               /member/CA",
                "congress-gov://member/state/CA/district/12,                   /member/CA/12",
                "congress-gov://member/congress/118/state/NY/district/0,       /member/congress/118/NY/0",
                "congress-gov://congress/117,                                  /congress/117",
                "congress-gov://committee/house/hsag00/bills,                  /committee/house/hsag00/bills",
                "congress-gov://committee-report/118/hrpt/5/text,              /committee-report/118/hrpt/5/text",
                "congress-gov://committee-print/118/house/48144,               /committee-print/118/house/48144",
                "congress-gov://committee-meeting/118/senate/115538,           /committee-meeting/118/senate/115538",
                "congress-gov://hearing/116/house/41365,                       /hearing/116/house/41365",
                "congress-gov://amendment/117/samdt/2137/cosponsors,           /amendment/117/samdt/2137/cosponsors",
                "congress-gov://law/118/public/5,                              /law/118/pub/5",
                "congress-gov://law/118/private,                               /law/118/priv",
                "congress-gov://law/118,                                       /law/118",
                "congress-gov://nomination/118/2/actions,                      /nomination/118/2/actions",
                "congress-gov://nomination/118/2/nominee/1,                    /nomination/118/2/1",
                "congress-gov://treaty/117/3,                                  /treaty/117/3",
                "congress-gov://treaty/114/13/suffix/b,                        /treaty/114/13/B",
                "congress-gov://congressional-record,                          /congressional-record",
                "congress-gov://daily-congressional-record/169/20/articles,    /daily-congressional-record/169/20/articles",
                "congress-gov://bound-congressional-record/1948/5/19,          /bound-congressional-record/1948/05/19",
                "congress-gov://house-communication/117/ec/3324,               /house-communication/117/ec/3324",
                "congress-gov://senate-communication/117/pm/12,                /senate-communication/117/pm/12",
                "congress-gov://house-requirement/8070/matching-communications, /house-requirement/8070/matching-communications",
                "congress-gov://crsreport/r47175,                              /crsreport/R47175",
                "congress-gov://house-vote/118/1/17/members,                   /house-vote/118/1/17/members"
        })
        @DisplayName("should map every identifier family to its upstream endpoint")
        void shouldMapEndpoints(String identifier, String endpoint) {
            assertThat(dispatcher.resolve(identifier).endpoint()).isEqualTo(endpoint);
        }

        @Test
        @DisplayName("should carry typed values for amendments, laws and committees")
        void shouldCarryTypedValues() {
            assertThat(dispatcher.resolve("congress-gov://amendment/117/h.amdt/5").param("amendmentType"))
                    .isEqualTo(AmendmentType.HAMDT);
            assertThat(dispatcher.resolve("congress-gov://law/118/pl/5").param("lawType"))
                    .isEqualTo(LawType.PUBLIC);
            assertThat(dispatcher.resolve("congress-gov://committee/Senate/SSJU00").param("chamber"))
                    .isEqualTo(Chamber.SENATE);
        }

        @Test
        @DisplayName("should expose the bound record date")
        void shouldExposeRecordDate() {
            ResourceRequest request = dispatcher.resolve("congress-gov://bound-congressional-record/2023/05/01");

            assertThat(request.param("date", LocalDate.class)).isEqualTo(LocalDate.of(2023, 5, 1));
            assertThat(request.intParam("year")).isEqualTo(2023);
        }

        @Test
        @DisplayName("should mark the nominee route with its implied sub-resource")
        void shouldMarkNomineeRoute() {
            ResourceRequest request = dispatcher.resolve("congress-gov://nomination/118/2/nominee/1");

            assertThat(request.subResource()).isEqualTo("nominee");
            assertThat(request.intParam("ordinal")).isEqualTo(1);
        }

        @Test
        @DisplayName("should forward query parameters except reserved ones")
        void shouldForwardQuery() {
            ResourceRequest request = dispatcher.resolve(
                    "congress-gov://congressional-record?y=2023&m=6&api_key=other&format=xml");

            assertThat(request.query()).containsOnlyKeys("y", "m");
            assertThat(request.query()).containsEntry("y", "2023");
        }
    }

    @Nested
    @DisplayName("Rejection")
    class Rejection {

        @Test
        @DisplayName("should reject a congress outside the supported range")
        void shouldRejectNominationCongress() {
            CongressApiException error = failure(() -> dispatcher.resolve("congress-gov://nomination/50/1"));

            assertThat(error.getKind()).isEqualTo(ErrorKind.INVALID_PARAMETER);
            assertThat(error.getMessage()).contains("50").contains("93 and 118");
        }

        @Test
        @DisplayName("should reject an unknown state code")
        void shouldRejectStateCode() {
            CongressApiException error = failure(() -> dispatcher.resolve("congress-gov://member/state/XX"));

            assertThat(error.getKind()).isEqualTo(ErrorKind.INVALID_PARAMETER);
            assertThat(error.getMessage()).contains("state code");
        }

        @Test
        @DisplayName("should reject month 13 in a bound record date")
        void shouldRejectMonth() {
            CongressApiException error = failure(
                    () -> dispatcher.resolve("congress-gov://bound-congressional-record/2023/13/01"));

            assertThat(error.getKind()).isEqualTo(ErrorKind.INVALID_PARAMETER);
            assertThat(error.getMessage()).contains("Month must be between 1 and 12");
        }

        @Test
        @DisplayName("should reject a communication sub-resource on the wrong chamber")
        void shouldRejectCommunicationChamberMismatch() {
            CongressApiException error = failure(
                    () -> dispatcher.resolve("congress-gov://committee/senate/ssju00/house-communication"));

            assertThat(error.getKind()).isEqualTo(ErrorKind.INVALID_PARAMETER);
            assertThat(dispatcher.resolve("congress-gov://committee/senate/ssju00/senate-communication").endpoint())
                    .isEqualTo("/committee/senate/ssju00/senate-communication");
        }

        @ParameterizedTest
        @CsvSource({
                "congress-gov://bill/118/hr/1/bogus",
                "congress-gov://bill/118/hr",
                "congress-gov://nomination/118/abc",
                "congress-gov://daily-congressional-record/169/articles",
                "congress-gov://member/congress/118",
                "congress-gov://treaty/117/3/suffix",
                "congress-gov://info/overview",
                "congress-gov://unknown/1"
        })
        @DisplayName("should reject identifiers that match no route shape")
        void shouldRejectUnknownShapes(String identifier) {
            assertThat(failure(() -> dispatcher.resolve(identifier)).getKind())
                    .isEqualTo(ErrorKind.INVALID_IDENTIFIER);
        }

        @Test
        @DisplayName("should reject a lower-case bioguide only when malformed")
        void shouldRejectMalformedBioguide() {
            CongressApiException error = failure(() -> dispatcher.resolve("congress-gov://member/p00019x"));

            assertThat(error.getKind()).isEqualTo(ErrorKind.INVALID_PARAMETER);
            assertThat(error.getMessage()).startsWith("Invalid bioguide ID: P00019X");
        }
    }

    private static CongressApiException failure(ThrowableAssert.ThrowingCallable call) {
        CongressApiException error = catchThrowableOfType(call, CongressApiException.class);
        assertThat(error).as("expected a CongressApiException").isNotNull();
        return error;
    }
}
