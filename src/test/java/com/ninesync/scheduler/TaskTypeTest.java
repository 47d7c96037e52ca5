package com.ninesync.scheduler;

import com.ninesync.sync.SyncStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TaskType factory tests
 */
class TaskTypeTest {

    @Test
    @DisplayName("Factories set the fields of their kind")
    void testFactories() {
        TaskType sync = TaskType.folderSync("INBOX", SyncStrategy.INCREMENTAL);
        assertThat(sync.getKind()).isEqualTo(TaskType.Kind.FOLDER_SYNC);
        assertThat(sync.getFolderName()).isEqualTo("INBOX");
        assertThat(sync.getStrategy()).isEqualTo(SyncStrategy.INCREMENTAL);

        TaskType warm = TaskType.cacheWarm("INBOX", 25);
        assertThat(warm.getMessageCount()).isEqualTo(25);
        assertThat(warm.toString()).isEqualTo("CacheWarm(INBOX, 25)");
    }

    @Test
    @DisplayName("Search folders are copied, null means all folders")
    void testSearchFolders() {
        List<String> folders = new ArrayList<>(List.of("INBOX"));
        TaskType search = TaskType.search("invoice", folders);
        folders.add("Spam");

        assertThat(search.getFolders()).containsExactly("INBOX");
        assertThat(TaskType.search("invoice", null).getFolders()).isEmpty();
    }

    @Test
    @DisplayName("Invalid parameters are rejected")
    void testValidation() {
        assertThatThrownBy(() -> TaskType.folderRefresh(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TaskType.search("", List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TaskType.cacheWarm("INBOX", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TaskType.accountSync(null)).isInstanceOf(NullPointerException.class);
    }
}
