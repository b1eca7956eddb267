package com.verve.test;

import com.verve.types.common.IdGenerator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class IdGeneratorTest {

    @Test
    public void shouldGenerateWellFormedIds() {
        for (int i = 0; i < 100; i++) {
            Assertions.assertTrue(IdGenerator.isTaskId(IdGenerator.newTaskId()));
            Assertions.assertTrue(IdGenerator.isEpicId(IdGenerator.newEpicId()));
            Assertions.assertTrue(IdGenerator.isRepoId(IdGenerator.newRepoId()));
        }
    }

    @Test
    public void shouldRejectMalformedIds() {
        Assertions.assertFalse(IdGenerator.isTaskId("tsk-ABCDE"));
        Assertions.assertFalse(IdGenerator.isTaskId("tsk-abcdef"));
        Assertions.assertFalse(IdGenerator.isTaskId(null));
        Assertions.assertFalse(IdGenerator.isEpicId("epc_01hzx3m4q8t2v6b9c0d1e2f3gi"));
        Assertions.assertFalse(IdGenerator.isRepoId(IdGenerator.newEpicId()));
    }

    @Test
    public void shouldOrderEpicIdsByCreationTime() throws InterruptedException {
        String first = IdGenerator.newEpicId();
        Thread.sleep(5L);
        String second = IdGenerator.newEpicId();

        Assertions.assertTrue(first.substring(0, 14).compareTo(second.substring(0, 14)) < 0);
    }
}
