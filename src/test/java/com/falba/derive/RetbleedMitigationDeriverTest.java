package com.falba.derive;

import com.falba.model.AttributeValue;
import com.falba.model.Fact;
import com.falba.model.Run;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RetbleedMitigationDeriverTest {

    private final RetbleedMitigationDeriver deriver = new RetbleedMitigationDeriver();

    private String mitigation(String cmdline, Boolean smtActive) {
        Run run = new Run("fio", "r1");
        run.addFact(Fact.of("cmdline", cmdline));
        if (smtActive != null) {
            run.addFact(Fact.of("lscpu_smp_active", smtActive));
        }
        AttributeValue value = deriver.derive(run).facts().get(0).value();
        return ((AttributeValue.StringValue) value).value();
    }

    @Nested
    @DisplayName("Command line rules")
    class Rules {

        @Test
        void off() {
            assertEquals("off", mitigation("retbleed=off", true));
        }

        @Test
        void autoNosmt_dependsOnSmt() {
            assertEquals("stibp", mitigation("retbleed=auto,nosmt", true));
            assertEquals("unret", mitigation("retbleed=auto,nosmt", false));
        }

        @Test
        void ibpb() {
            assertEquals("ibpb", mitigation("quiet retbleed=ibpb", false));
        }

        @Test
        void unret_dependsOnSmt() {
            assertEquals("stibp", mitigation("retbleed=unret", true));
            assertEquals("unret", mitigation("retbleed=unret", false));
        }

        @Test
        @DisplayName("unret,nosmt is shadowed by the earlier unret rule")
        void unretNosmt_matchesUnretFirst() {
            assertEquals("unret", mitigation("retbleed=unret,nosmt", false));
        }

        @Test
        void noRetbleedParameter_isUnknown() {
            assertEquals("unknown", mitigation("quiet splash", true));
        }
    }

    @Test
    void missingSmtFact_countsAsInactive() {
        assertEquals("unret", mitigation("retbleed=auto,nosmt", null));
    }

    @Test
    void missingCmdline_derivesNothing() {
        assertTrue(deriver.derive(new Run("fio", "r1")).isEmpty());
    }
}
