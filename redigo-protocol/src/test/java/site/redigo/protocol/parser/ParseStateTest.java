package site.redigo.protocol.parser;

import org.junit.jupiter.api.Test;
import site.redigo.datastructure.RedisBytes;

import static org.junit.jupiter.api.Assertions.*;

class ParseStateTest {

    @Test
    public void testFinished() {
        final ParseState state = new ParseState();
        // 没有期望参数时不算完成
        assertFalse(state.finished());

        state.expectedArgsCount = 2;
        state.args.add(RedisBytes.fromString("GET"));
        assertFalse(state.finished());
        state.args.add(RedisBytes.fromString("key"));
        assertTrue(state.finished());
    }

    @Test
    public void testReset() {
        final ParseState state = new ParseState();
        state.readingMultiLine = true;
        state.expectedArgsCount = 1;
        state.msgType = '$';
        state.bulkLen = 10;
        state.args.add(RedisBytes.fromString("x"));

        state.reset();

        assertFalse(state.readingMultiLine);
        assertEquals(0, state.expectedArgsCount);
        assertEquals(0, state.msgType);
        assertEquals(0, state.bulkLen);
        assertTrue(state.args.isEmpty());
    }
}
