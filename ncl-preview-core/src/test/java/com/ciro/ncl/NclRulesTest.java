package com.ciro.ncl;

import com.ciro.ncl.component.PreviewComponent;
import com.ciro.ncl.directive.DirectivePass;
import com.tngtech.archunit.core.domain.JavaClass;
import com.tngtech.archunit.core.domain.JavaModifier;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchCondition;
import com.tngtech.archunit.lang.ArchRule;
import com.tngtech.archunit.lang.ConditionEvents;
import com.tngtech.archunit.lang.SimpleConditionEvent;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.fields;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.GeneralCodingRules.NO_CLASSES_SHOULD_ACCESS_STANDARD_STREAMS;

@AnalyzeClasses(packages = "com.ciro.ncl", importOptions = ImportOption.DoNotIncludeTests.class)
public class NclRulesTest {

    static final ArchCondition<JavaClass> HAVE_NO_ARG_CONSTRUCTOR =
            new ArchCondition<JavaClass>("tener un constructor vacío") {
                @Override
                public void check(JavaClass item, ConditionEvents events) {
                    if (item.tryGetConstructor().isEmpty()) {
                        events.add(SimpleConditionEvent.violated(item,
                                item.getName() + " no tiene constructor vacío"));
                    }
                }
            };

    // 1. Las pasadas se comparten entre compilaciones: nada de estado mutable
    @ArchTest
    static final ArchRule passes_are_stateless = fields()
            .that().areDeclaredInClassesThat().areAssignableTo(DirectivePass.class)
            .should().beStatic().andShould().beFinal()
            .because("La lista de pasadas es única para todo el proceso.")
            .allowEmptyShould(true);

    // 2. Componentes del catálogo instanciables sin argumentos
    @ArchTest
    static final ArchRule components_have_no_arg_constructor = classes()
            .that().areAssignableTo(PreviewComponent.class)
            .and().doNotHaveModifier(JavaModifier.ABSTRACT)
            .should(HAVE_NO_ARG_CONSTRUCTOR)
            .because("El catálogo los registra con new.");

    // 3. El compilador no sabe nada del servidor
    @ArchTest
    static final ArchRule core_has_no_server_dependencies = noClasses()
            .should().dependOnClassesThat().resideInAnyPackage("io.undertow..", "com.github.benmanes..", "com.typesafe..");

    // 4. Solo slf4j
    @ArchTest
    static final ArchRule no_standard_streams = NO_CLASSES_SHOULD_ACCESS_STANDARD_STREAMS;
}
