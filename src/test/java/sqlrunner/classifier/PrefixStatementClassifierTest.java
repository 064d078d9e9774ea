package sqlrunner.classifier;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import sqlrunner.model.ClassifiedStatement;
import sqlrunner.model.StatementCategory;

import static org.assertj.core.api.Assertions.*;

class PrefixStatementClassifierTest {

    private final PrefixStatementClassifier classifier = new PrefixStatementClassifier();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "SELECT * FROM t|SELECT",
            "  select 1  |SELECT",
            "create table t (x int)|CREATE_TABLE",
            "CREATE   TABLE t (x int)|CREATE_TABLE",
            "CREATE INDEX idx ON t(x)|CREATE_INDEX",
            "create unique index idx ON t(x)|CREATE_INDEX",
            "DROP TABLE t|DROP_TABLE",
            "ALTER TABLE t ADD COLUMN y INT|ALTER_TABLE",
            "insert into t values (1)|INSERT",
            "UPDATE t SET x = 2|UPDATE",
            "delete from t|DELETE",
            "WITH c AS (SELECT 1) SELECT * FROM c|OTHER",
            "-- comment\\nSELECT 1|OTHER",
            "PRAGMA table_info(t)|OTHER",
            "SELECTED|OTHER"
    })
    void classifiesByLeadingKeywords(String sql, StatementCategory expected) {
        assertThat(classifier.classify(sql.replace("\\n", "\n")).category()).isEqualTo(expected);
    }

    @Test
    void keywordsMaySpanAnyWhitespace() {
        assertThat(classifier.classify("CREATE\n\tTABLE t (x INT)").category())
                .isEqualTo(StatementCategory.CREATE_TABLE);
        assertThat(classifier.classify("create\r\nunique\tindex i on t(x)").category())
                .isEqualTo(StatementCategory.CREATE_INDEX);
    }

    @Test
    void stripsWhitespaceAndExactlyOneTerminator() {
        ClassifiedStatement statement = classifier.classify("  SELECT 1;;  ");

        assertThat(statement.text()).isEqualTo("SELECT 1;");
        assertThat(statement.normalized()).isEqualTo("SELECT 1;");
        assertThat(statement.category()).isEqualTo(StatementCategory.SELECT);
    }

    @Test
    void trailingTerminatorDoesNotChangeCategory() {
        assertThat(classifier.classify("DELETE FROM t;").category())
                .isEqualTo(classifier.classify("DELETE FROM t").category());
    }

    @Test
    void classificationIsIdempotent() {
        ClassifiedStatement first = classifier.classify("  insert into t values (1) ; ");
        ClassifiedStatement second = classifier.classify(first.text());

        assertThat(second.text()).isEqualTo(first.text());
        assertThat(second.category()).isEqualTo(first.category());
    }

    @Test
    void normalizedIsUppercaseOfText() {
        ClassifiedStatement statement = classifier.classify("select Name from Customers");

        assertThat(statement.text()).isEqualTo("select Name from Customers");
        assertThat(statement.normalized()).isEqualTo("SELECT NAME FROM CUSTOMERS");
    }

    @Test
    void extractsCreateTableName() {
        assertThat(classifier.classify("CREATE TABLE people (id INT)").targetTable()).isEqualTo("people");
        assertThat(classifier.classify("create table if not exists Orders(id int)").targetTable()).isEqualTo("Orders");
        assertThat(classifier.classify("CREATE TABLE public.\"My Table\" (id INT)").targetTable()).isEqualTo("My Table");
        assertThat(classifier.classify("CREATE TABLE `quoted` (id INT)").targetTable()).isEqualTo("quoted");
    }

    @Test
    void extractsDropTableName() {
        assertThat(classifier.classify("DROP TABLE people").targetTable()).isEqualTo("people");
        assertThat(classifier.classify("drop table if exists main.people;").targetTable()).isEqualTo("people");
        assertThat(classifier.classify("DROP TABLE [legacy]").targetTable()).isEqualTo("legacy");
    }

    @Test
    void unreadableTableNameFallsBackToPlaceholder() {
        ClassifiedStatement statement = classifier.classify("CREATE TABLE (id INT)");

        assertThat(statement.category()).isEqualTo(StatementCategory.CREATE_TABLE);
        assertThat(statement.tableNameOrPlaceholder()).isEqualTo(ClassifiedStatement.UNKNOWN_TABLE);
    }

    @Test
    void otherCategoriesCarryNoTableName() {
        assertThat(classifier.classify("INSERT INTO people VALUES (1)").targetTable()).isNull();
    }

    @Test
    void nullOrBlankInputIsOther() {
        assertThat(classifier.classify(null).category()).isEqualTo(StatementCategory.OTHER);
        assertThat(classifier.classify("   ").text()).isEmpty();
    }
}
