package configstore.domain.store;

import configstore.domain.exceptions.ConfigUsageError;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class ScopeTest {
    @Test
    public void testPath() {
        Assertions.assertEquals("myapp", Scope.of("myapp").path());
        Assertions.assertEquals("myapp/testns/sub", Scope.of("myapp", "testns", "sub").path());
        Assertions.assertEquals(List.of("myapp", "testns"), Scope.of("myapp", "testns").segments());
    }

    @Test
    public void testRejectsUnsafeSegments() {
        Assertions.assertThrows(ConfigUsageError.class, () -> Scope.of(""));
        Assertions.assertThrows(ConfigUsageError.class, () -> Scope.of("myapp", ".."));
        Assertions.assertThrows(ConfigUsageError.class, () -> Scope.of("myapp", "a/b"));
        Assertions.assertThrows(ConfigUsageError.class, () -> Scope.of(".", "ns"));
        Assertions.assertThrows(ConfigUsageError.class, () -> Scope.of(null));
    }
}
