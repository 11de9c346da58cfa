package com.deepknow.goodface.copilot.domain.context;

import com.deepknow.goodface.copilot.domain.agent.ContextProvider;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FileContextCacheTest {

    private final FileContextCache cache = new FileContextCache();

    @Test
    void emptyCacheYieldsNoContextMarker() {
        assertThat(cache.contextFor("what does this do")).isEqualTo(ContextProvider.NO_CONTEXT);
    }

    @Test
    void mentionedFilesAreIncluded() {
        cache.put("src/app/Main.java", "class Main {}", 1L);
        cache.put("src/app/Util.java", "class Util {}", 2L);
        cache.put("README.md", "# readme", 3L);

        String context = cache.contextFor("Why does Main.java call util.java twice?");

        assertThat(context)
                .contains("--- START FILE: src/app/Main.java ---\nclass Main {}\n--- END FILE: src/app/Main.java ---")
                .contains("--- START FILE: src/app/Util.java ---")
                .doesNotContain("README.md");
    }

    @Test
    void withoutMentionTheLastUpdatedFileIsUsed() {
        cache.put("a.py", "print('a')", 1L);
        cache.put("b.py", "print('b')", 2L);
        cache.put("a.py", "print('a2')", 3L);

        String context = cache.contextFor("explain the current file");

        assertThat(context).contains("--- START FILE: a.py ---\nprint('a2')").doesNotContain("b.py");
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void putReturnsCacheSizeAndEntriesKeepUpdateOrder() {
        assertThat(cache.put("x.ts", "1", 1L)).isEqualTo(1);
        assertThat(cache.put("y.ts", "2", 2L)).isEqualTo(2);
        assertThat(cache.put("x.ts", "3", 3L)).isEqualTo(2);

        assertThat(cache.entries()).extracting(CachedFile::getPath).containsExactly("y.ts", "x.ts");
        assertThat(cache.get("x.ts").getContent()).isEqualTo("3");
    }
}
