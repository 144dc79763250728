package com.jobd.cli;

import com.jobd.core.JobTemplates;
import com.jobd.model.Job;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AddCommandTest {

    @Test
    void parsesStrictJson() {
        Job job = AddCommand.parseJob("{\"name\":\"backup\",\"command\":\"tar czf /tmp/b.tgz .\",\"cwd\":\"/srv\",\"maxRetries\":1}");

        assertEquals("backup", job.getName());
        assertEquals("tar czf /tmp/b.tgz .", job.getCommand());
        assertEquals("/srv", job.getWorkingDirectory());
        assertEquals(1, job.getMaxRetries());
    }

    @Test
    void parsesUnquotedKeyValueForm() {
        Job job = AddCommand.parseJob("{name:report, command:echo done, maxRetries:2, enabled:false}");

        assertEquals("report", job.getName());
        assertEquals("echo done", job.getCommand());
        assertEquals(2, job.getMaxRetries());
        assertFalse(job.isEnabled());
    }

    @Test
    void parsesSingleQuotedJson() {
        Job job = AddCommand.parseJob("{'name':'x','command':'ls -la','env':{'A':'1'}}");

        assertEquals("x", job.getName());
        assertEquals("ls -la", job.getCommand());
        assertEquals("1", job.getEnvironment().get("A"));
    }

    @Test
    void garbageYieldsNull() {
        assertNull(AddCommand.parseJob("definitely not json"));
    }

    @Test
    void normalizerQuotesValuesButKeepsLiterals() {
        assertEquals("{\"name\":\"a b\", \"priority\":3, \"enabled\":true, \"description\":null}",
                AddCommand.normalizeMaybeUnquotedJson("{name:a b, priority:3, enabled:true, description:null}"));
    }

    @Test
    void templateWithJsonOverrides() {
        Job job = AddCommand.resolveJob("{name:my backup, maxRetries:1}", "database-backup", JobTemplates.load());

        assertEquals("my backup", job.getName());
        assertEquals(1, job.getMaxRetries());
        assertEquals("0 2 * * *", job.getSchedule().getCron());
        assertEquals("/backups", job.getWorkingDirectory());
    }

    @Test
    void templateAloneNeedsNoJson() {
        Job job = AddCommand.resolveJob(null, "disk-monitor", JobTemplates.load());

        assertEquals("Disk Space Monitor", job.getName());
    }

    @Test
    void unknownTemplateOrBrokenJsonIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> AddCommand.resolveJob(null, "nope", JobTemplates.load()));
        assertThrows(IllegalArgumentException.class, () -> AddCommand.resolveJob("[1,", null, null));
    }
}
