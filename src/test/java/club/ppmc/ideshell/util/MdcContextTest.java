package club.ppmc.ideshell.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void setBuildSessionPutsId() {
        MdcContext.setBuildSession("build-1");
        assertEquals("build-1", MDC.get(MdcContext.BUILD_SESSION_ID));
        assertNull(MDC.get(MdcContext.TERMINAL_SESSION_ID));
    }

    @Test
    void setTerminalSessionPutsId() {
        MdcContext.setTerminalSession("term-1");
        assertEquals("term-1", MDC.get(MdcContext.TERMINAL_SESSION_ID));
    }

    @Test
    void clearRemovesOnlyOwnKeys() {
        MDC.put("requestId", "r-1");
        MdcContext.setBuildSession("build-1");
        MdcContext.setTerminalSession("term-1");

        MdcContext.clear();

        assertNull(MDC.get(MdcContext.BUILD_SESSION_ID));
        assertNull(MDC.get(MdcContext.TERMINAL_SESSION_ID));
        assertEquals("r-1", MDC.get("requestId"));
    }
}
