package org.calista.arasaka.tot.core;

import org.calista.arasaka.tot.model.SearchOutcome;
import org.calista.arasaka.tot.search.TreeOfThoughts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ToTComposerTest {

    @TempDir
    Path dir;

    @Test
    void sampleScriptSolvesByWorkingBackwards() throws Exception {
        try (ToTKernel kernel = ToTKernel.builder().configRoot(dir).build(Path.of("tot.json"));
             TreeOfThoughts tot = new ToTComposer(kernel).buildTreeOfThoughts()) {

            assertTrue(Files.exists(dir.resolve("tot.json")));
            assertTrue(Files.exists(dir.resolve("data").resolve("collaborators.json")));

            SearchOutcome out = tot.submit("How do I know the proof is right?");

            assertTrue(out.isCompleted());
            assertEquals("Verified by working backwards", out.result.answer);
            assertEquals(0.9, out.result.score);
            assertFalse(out.result.fallback);
            assertEquals(2, out.result.path.size());
            assertTrue(kernel.store().isArchived(out.searchId));
        }
    }

    @Test
    void unknownCollaboratorKindIsRejected() throws Exception {
        Files.writeString(dir.resolve("tot.json"), "{\"collaborators\":{\"kind\":\"remote\"}}");
        try (ToTKernel kernel = ToTKernel.builder().configRoot(dir).build(Path.of("tot.json"))) {
            assertThrows(IllegalArgumentException.class, () -> new ToTComposer(kernel).buildTreeOfThoughts());
        }
    }
}
