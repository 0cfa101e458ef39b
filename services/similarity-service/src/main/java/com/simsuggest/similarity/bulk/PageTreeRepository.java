package com.simsuggest.similarity.bulk;

import com.simsuggest.similarity.persistence.JdbcUtils;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class PageTreeRepository {
    /** Folder, recycler and menu separator pages carry no content of their own. */
    static final List<Integer> STRUCTURAL_DOKTYPES = List.of(254, 255, 199);

    private final JdbcTemplate jdbcTemplate;

    public PageTreeRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Root page followed by every non-deleted default-language content page below it, level by level.
     * Structural pages are neither returned nor descended into.
     */
    public List<Integer> findContentPageIds(int rootPageId) {
        Set<Integer> uids = new LinkedHashSet<>();
        uids.add(rootPageId);
        List<Integer> level = List.of(rootPageId);
        while (!level.isEmpty()) {
            List<Object> args = new ArrayList<>(level);
            args.addAll(STRUCTURAL_DOKTYPES);
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(
                "SELECT uid FROM pages WHERE pid IN (" + placeholders(level.size()) + ") "
                    + "AND doktype NOT IN (" + placeholders(STRUCTURAL_DOKTYPES.size()) + ") "
                    + "AND sys_language_uid = 0 AND deleted = 0 ORDER BY pid, sorting, uid",
                args.toArray()
            );
            List<Integer> next = new ArrayList<>();
            for (Map<String, Object> row : rows) {
                Integer uid = JdbcUtils.asInt(row.get("uid"));
                if (uid != null && uid > 0 && uids.add(uid)) {
                    next.add(uid);
                }
            }
            level = next;
        }
        return new ArrayList<>(uids);
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
