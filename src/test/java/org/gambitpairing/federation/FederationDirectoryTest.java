package org.gambitpairing.federation;

import org.gambitpairing.exception.DuplicateFederationCodeException;
import org.gambitpairing.exception.UnknownFederationCodeException;
import org.gambitpairing.model.FederationProfile;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FederationDirectoryTest {

    @Test
    void withDefaults_registersFideUscfAndCfc() {
        try (FederationDirectory directory = FederationDirectory.withDefaults()) {
            assertEquals(3, directory.all().size());
            assertTrue(directory.contains("FIDE"));
            assertTrue(directory.contains("uscf"), "Lookups ignore case");
            assertEquals("Chess Federation of Canada", directory.lookup("cfc").name());
        }
    }

    @Test
    void register_canonicalizesCode() {
        try (FederationDirectory directory = new FederationDirectory()) {
            Federation federation = directory.register("  ecf ", "English Chess Federation");
            assertEquals("ECF", federation.code());
            assertEquals(federation, directory.lookup("Ecf"));
        }
    }

    @Test
    void register_rejectsDuplicateCodeRegardlessOfCase() {
        try (FederationDirectory directory = FederationDirectory.withDefaults()) {
            DuplicateFederationCodeException e = assertThrows(DuplicateFederationCodeException.class,
                () -> directory.register("fide", "Another FIDE"));
            assertTrue(e.getMessage().contains("FIDE"));
            assertEquals("International Chess Federation", directory.lookup("FIDE").name(),
                "The original registration must survive");
        }
    }

    @Test
    void lookup_unknownCodeThrowsInsteadOfGuessing() {
        try (FederationDirectory directory = FederationDirectory.withDefaults()) {
            UnknownFederationCodeException e = assertThrows(UnknownFederationCodeException.class,
                () -> directory.lookup("XYZ"));
            assertEquals("XYZ", e.getCode());
        }
    }

    @Test
    void close_rejectsFurtherUse() {
        FederationDirectory directory = FederationDirectory.withDefaults();
        directory.close();

        assertTrue(directory.isClosed());
        assertThrows(IllegalStateException.class, () -> directory.lookup("FIDE"));
        assertThrows(IllegalStateException.class, () -> directory.register("ECF", "English Chess Federation"));
    }

    @Test
    void separateDirectoriesDoNotShareRegistrations() {
        try (FederationDirectory first = new FederationDirectory();
             FederationDirectory second = new FederationDirectory()) {
            first.register("ECF", "English Chess Federation");
            assertFalse(second.contains("ECF"));
            second.register("ECF", "English Chess Federation");
        }
    }

    @Test
    void federationProfile_resolvesThroughDirectory() {
        try (FederationDirectory directory = FederationDirectory.withDefaults()) {
            assertEquals("CFC", FederationProfile.of("cfc").resolve(directory).code());
            assertThrows(UnknownFederationCodeException.class,
                () -> FederationProfile.of("NOPE").resolve(directory));
        }
    }
}
