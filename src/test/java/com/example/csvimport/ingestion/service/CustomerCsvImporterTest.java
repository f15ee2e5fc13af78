package com.example.csvimport.ingestion.service;

import com.example.csvimport.ingestion.model.ImportReport;
import com.example.csvimport.ingestion.model.RejectionReason;
import com.example.csvimport.ingestion.model.RowRejection;
import com.example.csvimport.ingestion.support.CamelCsvParserFactory;
import com.example.csvimport.ingestion.support.EncodingException;
import com.example.csvimport.ingestion.support.OperationTimeoutException;
import com.example.csvimport.ingestion.support.StoreUnavailableException;
import com.mongodb.MongoTimeoutException;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * {@link CustomerCsvImporter} unit tests.
 *
 * <p>Runs the real parser and validator against an in-memory record store that enforces the
 * case-insensitive email uniqueness of the real one.</p>
 */
@DisplayName("customer csv importer")
class CustomerCsvImporterTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private InMemoryCustomerStore store;
    private CustomerCsvImporter importer;

    @BeforeEach
    void setUp() {
        store = new InMemoryCustomerStore();
        importer = new CustomerCsvImporter(new CamelCsvParserFactory(), new RowValidator(), store.repository(),
                clock, 100);
    }

    @Test
    @DisplayName("header plus 5 rows with age=0 on row 3 inserts 4 and reports (3, AGE_OUT_OF_RANGE)")
    void importCsv_oneOutOfRangeAge_insertsTheRest() {
        // given
        String csv = """
                name,email,age
                Alice,alice@example.com,30
                Bob,bob@example.org,25
                Carol,carol@example.com,0
                Dave,dave@example.com,41
                Erin,erin@example.com,58
                """;

        // when
        ImportReport report = importer.importCsv(stream(csv), "people.csv", NOW.plusSeconds(60));

        // then
        assertThat(report.source()).isEqualTo("people.csv");
        assertThat(report.totalRows()).isEqualTo(5);
        assertThat(report.inserted()).isEqualTo(4);
        assertThat(report.invalid()).isEqualTo(1);
        assertThat(report.duplicateEmail()).isZero();
        assertThat(report.rejections()).containsExactly(RowRejection.of(3, RejectionReason.AGE_OUT_OF_RANGE));
        assertThat(store.emails()).containsExactly("alice@example.com", "bob@example.org", "dave@example.com",
                "erin@example.com");
    }

    @Test
    @DisplayName("rejects a second occurrence of an email in the same file regardless of case")
    void importCsv_duplicateEmailInFile_isRejectedCaseInsensitively() {
        String csv = """
                name,email,age
                Alice,alice@example.com,30
                Alice Again,ALICE@Example.com,31
                """;

        ImportReport report = importer.importCsv(stream(csv), "dupes.csv", NOW.plusSeconds(60));

        assertThat(report.inserted()).isEqualTo(1);
        assertThat(report.duplicateEmail()).isEqualTo(1);
        assertThat(report.rejections()).containsExactly(RowRejection.of(2, RejectionReason.DUPLICATE_EMAIL));
        assertThat(store.emails()).containsExactly("alice@example.com");
    }

    @Test
    @DisplayName("re-importing the same file inserts nothing and reports every row as duplicate")
    void importCsv_sameFileTwice_secondImportOnlyDuplicates() {
        String csv = "name,email,age\nAlice,alice@example.com,30\nBob,bob@example.org,25\n";
        importer.importCsv(stream(csv), "first.csv", NOW.plusSeconds(60));

        ImportReport second = importer.importCsv(stream(csv), "second.csv", NOW.plusSeconds(60));

        assertThat(second.inserted()).isZero();
        assertThat(second.duplicateEmail()).isEqualTo(2);
        assertThat(store.emails()).hasSize(2);
    }

    @Test
    @DisplayName("malformed and invalid rows never stop the rows after them")
    void importCsv_rowLevelFailures_doNotAbort() {
        String csv = """
                name,email,age
                Alice,alice@example.com
                B,b@example.com,20
                Carl,not-an-email,20
                Dora,dora@example.com,twenty
                Evan,evan@example.com,33
                """;

        ImportReport report = importer.importCsv(stream(csv), "mixed.csv", NOW.plusSeconds(60));

        assertThat(report.totalRows()).isEqualTo(5);
        assertThat(report.inserted()).isEqualTo(1);
        assertThat(report.invalid()).isEqualTo(4);
        assertThat(report.rejections()).extracting(RowRejection::reason).containsExactly(
                RejectionReason.MALFORMED_ROW,
                RejectionReason.NAME_TOO_SHORT,
                RejectionReason.INVALID_EMAIL_FORMAT,
                RejectionReason.AGE_NOT_INTEGER);
        assertThat(report.rejections()).extracting(RowRejection::row).containsExactly(1L, 2L, 3L, 4L);
    }

    @Test
    @DisplayName("caps the listed rejections but keeps counting")
    void importCsv_manyRejections_truncatesList() {
        importer = new CustomerCsvImporter(new CamelCsvParserFactory(), new RowValidator(), store.repository(),
                clock, 1);

        ImportReport report = importer.importCsv(stream("A,a@b.co,1\nB,b@b.co,1\nC,c@b.co,1\n"), "noisy.csv",
                NOW.plusSeconds(60));

        assertThat(report.invalid()).isEqualTo(3);
        assertThat(report.rejections()).hasSize(1);
        assertThat(report.rejectionsTruncated()).isTrue();
    }

    @Test
    @DisplayName("aborts the whole import on invalid UTF-8 without inserting")
    void importCsv_invalidEncoding_throws() {
        byte[] content = { 'A', 'l', (byte) 0xFF, ',', 'a', '@', 'b', '.', 'c', 'o', ',', '3', '\n' };

        assertThatThrownBy(() -> importer.importCsv(new ByteArrayInputStream(content), "latin1.csv",
                NOW.plusSeconds(60)))
                .isInstanceOf(EncodingException.class);
        assertThat(store.emails()).isEmpty();
    }

    @Test
    @DisplayName("fails with a timeout once the deadline has passed, before touching the store")
    void importCsv_deadlinePassed_throwsTimeout() {
        CustomerRepository repository = mock(CustomerRepository.class);
        importer = new CustomerCsvImporter(new CamelCsvParserFactory(), new RowValidator(), repository, clock, 100);

        assertThatThrownBy(() -> importer.importCsv(stream("Alice,alice@example.com,30\n"), "slow.csv",
                NOW.minusSeconds(1)))
                .isInstanceOf(OperationTimeoutException.class);
        verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("propagates a store outage instead of recording it per row")
    void importCsv_storeUnavailable_propagates() {
        CustomerRepository repository = mock(CustomerRepository.class);
        when(repository.insert(any())).thenThrow(
                new StoreUnavailableException("down", new MongoTimeoutException("timed out")));
        importer = new CustomerCsvImporter(new CamelCsvParserFactory(), new RowValidator(), repository, clock, 100);

        assertThatThrownBy(() -> importer.importCsv(stream("Alice,alice@example.com,30\nBob,bob@example.org,25\n"),
                "down.csv", NOW.plusSeconds(60)))
                .isInstanceOf(StoreUnavailableException.class);
        verify(repository).insert(any());
    }

    @Test
    @DisplayName("a field far longer than usual is a normal row and the rows after it are still read")
    void importCsv_veryLongName_doesNotAbortImport() {
        // given
        String longName = "N".repeat(5000);
        String csv = "Alice,alice@example.com,30\n"
                + longName + ",long@example.com,40\n"
                + "Bob,bob@example.org,25\n";

        // when
        ImportReport report = importer.importCsv(stream(csv), "long.csv", NOW.plusSeconds(60));

        // then
        assertThat(report.totalRows()).isEqualTo(3);
        assertThat(report.inserted()).isEqualTo(3);
        assertThat(report.errors()).isZero();
        assertThat(store.emails()).containsExactly("alice@example.com", "long@example.com", "bob@example.org");
    }

    private static ByteArrayInputStream stream(String csv) {
        return new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8));
    }
}
