package branchledger.twopc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BranchAddressTest {

    @Test
    void parsesHostPort() {
        BranchAddress a = BranchAddress.parse("bank-delhi:50052");
        assertEquals("bank-delhi", a.getHost());
        assertEquals(50052, a.getPort());
        assertThrows(IllegalArgumentException.class, () -> BranchAddress.parse("no-port"));
        assertThrows(IllegalArgumentException.class, () -> BranchAddress.parse("h:0"));
    }

    @Test
    void loopbackSpellingsAreTheSameEndpoint() {
        BranchAddress self = new BranchAddress("localhost", 50051);
        assertTrue(self.isSameEndpoint(new BranchAddress("127.0.0.1", 50051)));
        assertTrue(self.isSameEndpoint(new BranchAddress("LOCALHOST", 50051)));
        assertFalse(self.isSameEndpoint(new BranchAddress("localhost", 50052)));
        assertFalse(self.isSameEndpoint(new BranchAddress("10.0.0.7", 50051)));
        assertFalse(self.isSameEndpoint(null));
    }

    @Test
    void hostsThatWouldBreakStoredRecordsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BranchAddress("bad|host", 50052));
        assertThrows(IllegalArgumentException.class, () -> new BranchAddress("bad host", 50052));
        assertThrows(IllegalArgumentException.class, () -> new BranchAddress("bad\nhost", 50052));
        assertThrows(IllegalArgumentException.class, () -> BranchAddress.parse("a|b:50052"));
        assertEquals("bank-delhi", new BranchAddress("  bank-delhi ", 50052).getHost());
    }
}
