package com.micaixbrl.core.generator.template;

import com.micaixbrl.core.generator.TypedMember;
import com.micaixbrl.core.generator.XbrlContext;
import com.micaixbrl.core.generator.XbrlPeriod;
import com.micaixbrl.core.generator.XbrlUnit;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders the {@code ix:resources} content: contexts and units.
 */
public final class ResourceRenderer {

    private ResourceRenderer() {
        // Utility class
    }

    public static String renderContexts(List<XbrlContext> contexts) {
        return contexts.stream().map(ResourceRenderer::renderContext).collect(Collectors.joining("\n"));
    }

    public static String renderUnits(List<XbrlUnit> units) {
        return units.stream().map(ResourceRenderer::renderUnit).collect(Collectors.joining("\n"));
    }

    /**
     * Renders one context with its entity, period and optional typed-member scenario.
     *
     * @param context context
     * @return {@code xbrli:context} element
     */
    public static String renderContext(XbrlContext context) {
        XbrlPeriod period = context.period();
        String periodXml = period.isInstant()
            ? "<xbrli:instant>" + period.instant() + "</xbrli:instant>"
            : "\n          <xbrli:startDate>" + period.startDate() + "</xbrli:startDate>"
                + "\n          <xbrli:endDate>" + period.endDate() + "</xbrli:endDate>";

        String scenarioXml = "";
        if (context.typedMember().isPresent()) {
            TypedMember member = context.typedMember().get();
            scenarioXml = "\n        <xbrli:scenario>"
                + "\n          <xbrldi:typedMember dimension=\"" + member.dimension() + "\">"
                + "\n            <mica:value>" + Markup.escape(member.value()) + "</mica:value>"
                + "\n          </xbrldi:typedMember>"
                + "\n        </xbrli:scenario>";
        }

        return "        <xbrli:context id=\"" + context.id() + "\">"
            + "\n          <xbrli:entity>"
            + "\n            <xbrli:identifier scheme=\"" + context.scheme() + "\">"
            + Markup.escape(context.identifier()) + "</xbrli:identifier>"
            + "\n          </xbrli:entity>"
            + "\n          <xbrli:period>" + periodXml
            + "\n          </xbrli:period>" + scenarioXml
            + "\n        </xbrli:context>";
    }

    public static String renderUnit(XbrlUnit unit) {
        return "        <xbrli:unit id=\"" + unit.id() + "\">"
            + "\n          <xbrli:measure>" + unit.measure() + "</xbrli:measure>"
            + "\n        </xbrli:unit>";
    }
}
