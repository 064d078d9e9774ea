package sqlrunner.history;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Result;
import org.apache.ibatis.annotations.Results;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

public interface HistoryMapper {

    @Update("CREATE TABLE IF NOT EXISTS query_history (" +
            "id IDENTITY PRIMARY KEY, " +
            "username VARCHAR(255) NOT NULL, " +
            "query_text CLOB NOT NULL, " +
            "success BOOLEAN NOT NULL, " +
            "error_message CLOB, " +
            "rows_affected INT, " +
            "executed_at TIMESTAMP NOT NULL)")
    void createTable();

    @Update("CREATE INDEX IF NOT EXISTS idx_query_history_user ON query_history(username, id)")
    void createIndex();

    @Insert("INSERT INTO query_history (username, query_text, success, error_message, rows_affected, executed_at) " +
            "VALUES (#{username}, #{queryText}, #{success}, #{errorMessage}, #{rowsAffected}, #{executedAt})")
    int insert(HistoryRow row);

    @Select("SELECT id, username, query_text, success, error_message, rows_affected, executed_at " +
            "FROM query_history WHERE username = #{username} ORDER BY id DESC LIMIT #{limit}")
    @Results(id = "HistoryRowMapping", value = {
            @Result(property = "id", column = "id", id = true),
            @Result(property = "username", column = "username"),
            @Result(property = "queryText", column = "query_text"),
            @Result(property = "success", column = "success"),
            @Result(property = "errorMessage", column = "error_message"),
            @Result(property = "rowsAffected", column = "rows_affected"),
            @Result(property = "executedAt", column = "executed_at")
    })
    List<HistoryRow> findRecent(@Param("username") String username, @Param("limit") int limit);

    /**
     * Id of the newest row that no longer fits within {@code capacity}, or null when nothing overflows.
     */
    @Select("SELECT id FROM query_history WHERE username = #{username} " +
            "ORDER BY id DESC LIMIT 1 OFFSET #{capacity}")
    Long findOverflowId(@Param("username") String username, @Param("capacity") int capacity);

    @Delete("DELETE FROM query_history WHERE username = #{username} AND id <= #{id}")
    int deleteUpTo(@Param("username") String username, @Param("id") long id);

    @Delete("DELETE FROM query_history WHERE username = #{username}")
    int deleteByUser(@Param("username") String username);

    @Select("SELECT COUNT(DISTINCT username) FROM query_history")
    int countUsers();
}
