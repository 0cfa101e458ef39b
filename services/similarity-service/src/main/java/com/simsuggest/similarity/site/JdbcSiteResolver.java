package com.simsuggest.similarity.site;

import com.simsuggest.similarity.document.DocumentRef;
import com.simsuggest.similarity.persistence.JdbcUtils;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Walks the page rootline up to the nearest site root. Records other than pages start from the page they are
 * stored on.
 */
@Component
public class JdbcSiteResolver implements SiteResolver {
    private static final int MAX_ROOTLINE_DEPTH = 99;
    private static final Pattern TABLE_NAME = Pattern.compile("[a-z0-9_]+");

    private final JdbcTemplate jdbcTemplate;

    public JdbcSiteResolver(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public SitePartition resolvePartition(DocumentRef ref, int languageId) {
        try {
            int pageId = ref.isPage() ? ref.id() : storagePageOf(ref);
            return new SitePartition(findRoot(pageId), languageId);
        } catch (DataAccessException e) {
            throw new RoutingFailedException("rootline lookup failed for " + ref, e);
        }
    }

    private int storagePageOf(DocumentRef ref) {
        if (!TABLE_NAME.matcher(ref.type()).matches()) {
            throw new RoutingFailedException("cannot route record type " + ref.type());
        }
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT pid FROM " + ref.type() + " WHERE uid = ?",
            ref.id()
        );
        Integer pid = rows.isEmpty() ? null : JdbcUtils.asInt(rows.get(0).get("pid"));
        if (pid == null || pid <= 0) {
            throw new RoutingFailedException("no storage page for " + ref);
        }
        return pid;
    }

    private int findRoot(int pageId) {
        int current = pageId;
        for (int depth = 0; depth < MAX_ROOTLINE_DEPTH; depth++) {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(
                "SELECT uid, pid, is_siteroot FROM pages WHERE uid = ? AND deleted = 0",
                current
            );
            if (rows.isEmpty()) {
                throw new RoutingFailedException("page not found in rootline: " + current);
            }
            Map<String, Object> row = rows.get(0);
            Integer pid = JdbcUtils.asInt(row.get("pid"));
            Integer siteRoot = JdbcUtils.asInt(row.get("is_siteroot"));
            if ((siteRoot != null && siteRoot == 1) || pid == null || pid == 0) {
                return current;
            }
            current = pid;
        }
        throw new RoutingFailedException("rootline too deep for page " + pageId);
    }
}
