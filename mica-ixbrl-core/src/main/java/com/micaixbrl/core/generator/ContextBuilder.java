package com.micaixbrl.core.generator;

import com.micaixbrl.core.model.EntityInfo;
import com.micaixbrl.core.model.EntityRole;
import com.micaixbrl.core.model.ManagementBodyMember;
import com.micaixbrl.core.model.WhitepaperData;
import com.micaixbrl.core.taxonomy.MicaTaxonomy;
import com.micaixbrl.core.util.LeiCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the contexts of a white paper instance.
 *
 * <p>Always produces {@value #INSTANT} (document date) and {@value #DURATION} (calendar year of
 * the document date) for the primary entity. Adds one typed-dimension context per secondary
 * entity with a distinct identifier and one per management body member and project person.</p>
 */
public class ContextBuilder {

    private static final Logger log = LoggerFactory.getLogger(ContextBuilder.class);

    public static final String INSTANT = "ctx_instant";
    public static final String DURATION = "ctx_duration";

    /**
     * Context id of a secondary entity.
     *
     * @param role issuer or operator
     * @return context id such as {@code ctx_issuer}
     */
    public static String entityContextId(EntityRole role) {
        return "ctx_" + role.key();
    }

    /**
     * Context id of a management body member.
     *
     * @param role entity the management body belongs to
     * @param index zero-based member index
     * @return context id such as {@code ctx_mgmt_offeror_0}
     */
    public static String managementContextId(EntityRole role, int index) {
        return "ctx_mgmt_" + role.key() + "_" + index;
    }

    public static String personContextId(int index) {
        return "ctx_person_involved_" + index;
    }

    /**
     * Returns the primary entity identifier, normalized.
     *
     * @param data white paper record
     * @return normalized LEI of the offeror
     * @throws MissingEntityIdentifierException if the LEI is absent or malformed
     */
    public static String requirePrimaryIdentifier(WhitepaperData data) {
        String lei = data.partA() == null ? null : data.partA().lei();
        if (lei == null || lei.isBlank()) {
            throw new MissingEntityIdentifierException("LEI is required for context generation");
        }
        if (!LeiCodes.isWellFormed(lei)) {
            throw new MissingEntityIdentifierException(
                "LEI '" + lei + "' is not a structurally valid legal entity identifier");
        }
        return LeiCodes.normalize(lei);
    }

    /**
     * Builds all contexts for the record.
     *
     * @param data white paper record
     * @param documentDate resolved document date
     * @return contexts in declaration order, ids unique
     * @throws MissingEntityIdentifierException if the primary LEI is unusable
     */
    public List<XbrlContext> build(WhitepaperData data, LocalDate documentDate) {
        String lei = requirePrimaryIdentifier(data);
        XbrlPeriod instant = XbrlPeriod.instant(documentDate);
        XbrlPeriod year = XbrlPeriod.calendarYearOf(documentDate);

        List<XbrlContext> contexts = new ArrayList<>();
        contexts.add(context(INSTANT, lei, instant, null));
        contexts.add(context(DURATION, lei, year, null));

        Set<String> seenIdentifiers = new HashSet<>();
        seenIdentifiers.add(lei);
        addEntityContext(contexts, seenIdentifiers, EntityRole.ISSUER, data.partB(), lei, year);
        addEntityContext(contexts, seenIdentifiers, EntityRole.OPERATOR, data.partC(), lei, year);

        addManagementContexts(contexts, EntityRole.OFFEROR, data.managementBodyMembers().offeror(), lei, year);
        addManagementContexts(contexts, EntityRole.ISSUER, data.managementBodyMembers().issuer(), lei, year);
        addManagementContexts(contexts, EntityRole.OPERATOR, data.managementBodyMembers().operator(), lei, year);

        for (int i = 0; i < data.projectPersons().size(); i++) {
            contexts.add(context(personContextId(i), lei, year,
                new TypedMember(dimension("PersonInvolvedInImplementationDimension"), "person_" + i)));
        }

        log.debug("Built {} contexts for entity {}", contexts.size(), lei);
        return List.copyOf(contexts);
    }

    private void addEntityContext(List<XbrlContext> contexts, Set<String> seenIdentifiers, EntityRole role,
                                  EntityInfo entity, String primaryLei, XbrlPeriod period) {
        if (entity == null || entity.lei() == null || entity.lei().isBlank() || LeiCodes.isNotApplicable(entity.lei())) {
            return;
        }
        String identifier = LeiCodes.normalize(entity.lei());
        if (!seenIdentifiers.add(identifier)) {
            log.debug("{} shares identifier {} with another entity, no separate context", role.displayName(), identifier);
            return;
        }
        contexts.add(context(entityContextId(role), primaryLei, period,
            new TypedMember(dimension(role.displayName() + "Dimension"), identifier)));
    }

    private void addManagementContexts(List<XbrlContext> contexts, EntityRole role,
                                       List<ManagementBodyMember> members, String lei, XbrlPeriod period) {
        String dimension = dimension(role.displayName() + "ManagementBodyMemberDimension");
        for (int i = 0; i < members.size(); i++) {
            contexts.add(context(managementContextId(role, i), lei, period, new TypedMember(dimension, "member_" + i)));
        }
    }

    private static XbrlContext context(String id, String lei, XbrlPeriod period, TypedMember member) {
        return new XbrlContext(id, lei, MicaTaxonomy.LEI_SCHEME, period, member);
    }

    private static String dimension(String localName) {
        return MicaTaxonomy.element(localName);
    }
}
