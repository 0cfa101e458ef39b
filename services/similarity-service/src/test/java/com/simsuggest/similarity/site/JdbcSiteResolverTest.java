package com.simsuggest.similarity.site;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.simsuggest.similarity.document.DocumentRef;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

@ExtendWith(MockitoExtension.class)
class JdbcSiteResolverTest {
    private static final String PAGE_SQL = "SELECT uid, pid, is_siteroot FROM pages WHERE uid = ? AND deleted = 0";

    @Mock
    private JdbcTemplate jdbcTemplate;

    @InjectMocks
    private JdbcSiteResolver resolver;

    @Test
    void walksRootlineToSiteRoot() {
        when(jdbcTemplate.queryForList(PAGE_SQL, 30)).thenReturn(List.of(page(30, 20, 0)));
        when(jdbcTemplate.queryForList(PAGE_SQL, 20)).thenReturn(List.of(page(20, 7, 1)));

        assertThat(resolver.resolvePartition(DocumentRef.page(30), 1)).isEqualTo(new SitePartition(20, 1));
    }

    @Test
    void topLevelPageIsItsOwnRoot() {
        when(jdbcTemplate.queryForList(PAGE_SQL, 4)).thenReturn(List.of(page(4, 0, 0)));

        assertThat(resolver.resolvePartition(DocumentRef.page(4), 0).rootContainerId()).isEqualTo(4);
    }

    @Test
    void recordsStartFromTheirStoragePage() {
        when(jdbcTemplate.queryForList("SELECT pid FROM tx_news_domain_model_news WHERE uid = ?", 9))
            .thenReturn(List.of(Map.of("pid", 12)));
        when(jdbcTemplate.queryForList(PAGE_SQL, 12)).thenReturn(List.of(page(12, 0, 1)));

        assertThat(resolver.resolvePartition(new DocumentRef("tx_news_domain_model_news", 9), 0).rootContainerId())
            .isEqualTo(12);
    }

    @Test
    void unsafeTableNameIsRejected() {
        assertThatThrownBy(() -> resolver.resolvePartition(new DocumentRef("pages; drop", 1), 0))
            .isInstanceOf(RoutingFailedException.class);
    }

    @Test
    void databaseErrorsBecomeRoutingFailures() {
        when(jdbcTemplate.queryForList(eq(PAGE_SQL), eq(30))).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> resolver.resolvePartition(DocumentRef.page(30), 0))
            .isInstanceOf(RoutingFailedException.class);
    }

    @Test
    void missingPageIsRoutingFailure() {
        when(jdbcTemplate.queryForList(anyString(), eq(99))).thenReturn(List.of());

        assertThatThrownBy(() -> resolver.resolvePartition(DocumentRef.page(99), 0))
            .isInstanceOf(RoutingFailedException.class);
    }

    private static Map<String, Object> page(int uid, int pid, int siteRoot) {
        return Map.of("uid", uid, "pid", pid, "is_siteroot", siteRoot);
    }
}
