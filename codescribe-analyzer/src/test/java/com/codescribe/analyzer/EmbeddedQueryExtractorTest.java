package com.codescribe.analyzer;

import com.codescribe.analyzer.queries.EmbeddedQueryExtractor;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddedQueryExtractorTest {

    private final EmbeddedQueryExtractor extractor = new EmbeddedQueryExtractor();

    @Test
    void findsStatementLiteralsInSourceOrder() {
        List<String> queries = extractor.extract("""
            class Dao {
                void run() {
                    exec("DELETE FROM audit WHERE age > 30");
                    exec("  insert into audit values (1)  ");
                    exec("CREATE TABLE t (id int)");
                }
            }
            """);
        assertEquals(List.of(
            "DELETE FROM audit WHERE age > 30",
            "insert into audit values (1)",
            "CREATE TABLE t (id int)"), queries);
    }

    @Test
    void concatenationOperandsAreTestedSeparately() {
        List<String> queries = extractor.extract("""
            class Dao {
                String q(int id) { return "SELECT * FROM users WHERE id = " + id + " AND active"; }
            }
            """);
        assertEquals(List.of("SELECT * FROM users WHERE id ="), queries);
    }

    @Test
    void duplicatesKeepFirstOccurrence() {
        List<String> queries = extractor.extract("""
            class Dao {
                void a() { exec("UPDATE t SET x = 1"); }
                void b() { exec("DROP TABLE t"); exec("UPDATE t SET x = 1"); }
            }
            """);
        assertEquals(List.of("UPDATE t SET x = 1", "DROP TABLE t"), queries);
    }

    @Test
    void keywordMustBeWholeWord() {
        assertTrue(extractor.extract("class A { String s = \"records updated today\"; }").isEmpty());
        assertTrue(extractor.extract("class A { String s = \"deleted_at column\"; }").isEmpty());
    }

    @Test
    void keywordAnywhereInLiteralMatches() {
        // keyword heuristic: prose that contains a keyword is reported too
        assertEquals(List.of("please select an option"),
            extractor.extract("class A { String s = \"please select an option\"; }"));
    }

    @Test
    void shortLiteralsAreIgnored() {
        assertTrue(extractor.extract("class A { String s = \"WITH \"; String t = \"MERGE\"; }").isEmpty());
    }

    @Test
    void textBlocksAreIncluded() {
        List<String> queries = extractor.extract("""
            class Dao {
                String q = \"""
                    WITH recent AS (SELECT * FROM orders)
                    SELECT count(*) FROM recent
                    \""";
            }
            """);
        assertEquals(List.of("WITH recent AS (SELECT * FROM orders)\nSELECT count(*) FROM recent"), queries);
    }

    @Test
    void unparsableSourceYieldsNothing() {
        assertTrue(extractor.extract("class { \"SELECT 1 FROM dual\"").isEmpty());
    }

    @Test
    void fixtureRepositoryQueries() throws IOException {
        Path repository = Paths.get(System.getProperty("user.dir")).getParent()
            .resolve("test-fixtures/inventory-app/src/main/java/com/example/inventory/StockRepository.java");

        List<String> queries = extractor.extract(Files.readString(repository));

        assertEquals(List.of(
            "SELECT quantity FROM stock WHERE sku = ?",
            "UPDATE stock SET quantity = ? WHERE sku = ?",
            "SELECT price\n  FROM catalog\n WHERE sku = ?"), queries);
    }
}
