package oktaauth;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

@DisplayName("Hexagonal Architecture Rules")
class HexagonalArchitectureTest {

    private static JavaClasses importedClasses;

    @BeforeAll
    static void setUp() {
        importedClasses = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("oktaauth");
    }

    @Nested
    @DisplayName("Core Layer Rules")
    class CoreLayerRules {

        @Test
        @DisplayName("Core should not depend on adapter")
        void coreShouldNotDependOnAdapter() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("oktaauth.core..")
                    .should().dependOnClassesThat().resideInAPackage("oktaauth.adapter..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on Vert.x or JAX-RS")
        void coreShouldNotDependOnTransport() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("oktaauth.core..")
                    .should().dependOnClassesThat().resideInAnyPackage("io.vertx..", "jakarta.ws.rs..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Model should not depend on ports or services")
        void modelShouldNotDependOnPortsOrServices() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("oktaauth.core.model..")
                    .should().dependOnClassesThat().resideInAnyPackage("oktaauth.core.port..", "oktaauth.core.service..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Port Rules")
    class PortRules {

        @Test
        @DisplayName("Outbound ports should be interfaces")
        void outboundPortsShouldBeInterfaces() {
            ArchRule rule = classes()
                    .that().resideInAPackage("oktaauth.core.port.out")
                    .and().areTopLevelClasses()
                    .should().beInterfaces();

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Inbound ports should be interfaces")
        void inboundPortsShouldBeInterfaces() {
            ArchRule rule = classes()
                    .that().resideInAPackage("oktaauth.core.port.in")
                    .and().areTopLevelClasses()
                    .should().beInterfaces();

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Adapter Layer Rules")
    class AdapterLayerRules {

        @Test
        @DisplayName("Inbound adapters should not depend on outbound adapters")
        void inboundShouldNotDependOnOutbound() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("oktaauth.adapter.in..")
                    .should().dependOnClassesThat().resideInAPackage("oktaauth.adapter.out..");

            rule.check(importedClasses);
        }
    }
}
