package com.ciro.ncl.standalone;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;
import io.undertow.server.HttpHandler;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.GeneralCodingRules.NO_CLASSES_SHOULD_ACCESS_STANDARD_STREAMS;

@AnalyzeClasses(packages = "com.ciro.ncl", importOptions = ImportOption.DoNotIncludeTests.class)
public class StandaloneRulesTest {

    // 1. El compilador no conoce el servidor
    @ArchTest
    static final ArchRule core_does_not_see_standalone = noClasses()
            .that().resideInAPackage("com.ciro.ncl..")
            .and().resideOutsideOfPackage("com.ciro.ncl.standalone..")
            .should().dependOnClassesThat().resideInAPackage("com.ciro.ncl.standalone..");

    // 2. Endpoints HTTP finales y sin herencia rara
    @ArchTest
    static final ArchRule http_endpoints_are_handlers = classes()
            .that().resideInAPackage("com.ciro.ncl.standalone..")
            .and().haveSimpleNameEndingWith("Endpoint")
            .and().doNotHaveSimpleName("WsEndpoint")
            .should().implement(HttpHandler.class)
            .andShould().haveModifier(com.tngtech.archunit.core.domain.JavaModifier.FINAL);

    // 3. Logs por slf4j
    @ArchTest
    static final ArchRule no_standard_streams = NO_CLASSES_SHOULD_ACCESS_STANDARD_STREAMS;
}
