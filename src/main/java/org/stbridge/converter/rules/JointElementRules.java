package org.stbridge.converter.rules;

import org.stbridge.converter.tree.StbDocument;
import org.stbridge.converter.tree.StbNode;
import org.stbridge.converter.tree.XmlHelper;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Joint relocation between member endpoint attributes (v2.0.2) and the {@code StbJointArrangements}
 * collection (v2.1.0).
 * <p>
 * Must run before the attribute pass strips the joint attributes from members.
 */
public class JointElementRules {

    static final String ARRANGEMENTS = "StbJointArrangements";
    static final String ARRANGEMENT = "StbJointArrangement";

    /**
     * Member kind with its container tags and the two endpoints in document order.
     */
    enum MemberKind {
        COLUMN("StbColumns", "StbColumn", Endpoint.TOP, Endpoint.BOTTOM),
        POST("StbPosts", "StbPost", Endpoint.TOP, Endpoint.BOTTOM),
        GIRDER("StbGirders", "StbGirder", Endpoint.START, Endpoint.END),
        BEAM("StbBeams", "StbBeam", Endpoint.START, Endpoint.END),
        BRACE("StbBraces", "StbBrace", Endpoint.START, Endpoint.END);

        final String container;
        final String element;
        final List<Endpoint> endpoints;

        MemberKind(String container, String element, Endpoint... endpoints) {
            this.container = container;
            this.element = element;
            this.endpoints = List.of(endpoints);
        }
    }

    /**
     * Legacy attribute suffix and the {@code starting_point} it maps to. A column top is its END.
     */
    enum Endpoint {
        TOP("top", "END"),
        BOTTOM("bottom", "START"),
        START("start", "START"),
        END("end", "END");

        final String jointAttr;
        final String kindAttr;
        final String idAttr;
        final String startingPoint;

        Endpoint(String suffix, String startingPoint) {
            this.jointAttr = "joint_" + suffix;
            this.kindAttr = "kind_joint_" + suffix;
            this.idAttr = "joint_id_" + suffix;
            this.startingPoint = startingPoint;
        }
    }

    private JointElementRules() {
    }

    /**
     * Creates one arrangement per member endpoint carrying a {@code joint_*} distance. The member's own
     * {@code joint_id_*} is kept when free; otherwise a fresh id above every existing one is synthesized.
     * Endpoints of members without {@code id_section} lose their joint attributes and get no arrangement.
     */
    public static void convertJointsTo210(StbDocument document, RuleContext context) {
        StbNode members = XmlHelper.getMembers(document).orElse(null);
        if (members == null) {
            context.report().debug("convertJointsTo210: No members found");
            return;
        }
        IdSynthesizer ids = context.ids();
        List<String> existing = new ArrayList<>();
        for (MemberKind kind : MemberKind.values()) {
            for (StbNode member : XmlHelper.collect(members, kind.container, kind.element)) {
                kind.endpoints.forEach(endpoint -> existing.add(member.attr(endpoint.idAttr)));
            }
        }
        ids.reserve(existing);

        List<StbNode> arrangements = new ArrayList<>();
        for (MemberKind kind : MemberKind.values()) {
            for (StbNode member : XmlHelper.collect(members, kind.container, kind.element)) {
                for (Endpoint endpoint : kind.endpoints) {
                    StbNode arrangement = relocate(member, kind, endpoint, context);
                    if (arrangement != null) {
                        arrangements.add(arrangement);
                    }
                }
            }
        }

        if (arrangements.isEmpty()) {
            context.report().debug("convertJointsTo210: No joints found in any members");
            return;
        }
        members.getOrCreateChild(ARRANGEMENTS).setChildren(ARRANGEMENT, arrangements);
        context.report().info("Joint elements: Converted " + arrangements.size() + " joints to v2.1.0 format");
    }

    private static StbNode relocate(StbNode member, MemberKind kind, Endpoint endpoint, RuleContext context) {
        String distance = member.attr(endpoint.jointAttr);
        if (distance == null) {
            return null;
        }
        String memberId = member.attr("id");
        String idSection = member.attr("id_section");
        String requested = member.attr(endpoint.idAttr);
        clearJointAttributes(member, endpoint);

        if (idSection == null || idSection.isEmpty()) {
            context.report().warn("Joint conversion skipped: " + kind + ":" + memberId
                    + " is missing id_section (" + endpoint.jointAttr + "=" + distance + ")");
            return null;
        }

        String id;
        if (requested != null && !requested.isEmpty() && context.ids().claim(requested)) {
            id = requested;
        } else {
            if (requested != null && !requested.isEmpty()) {
                context.report().warn("Duplicate joint id \"" + requested + "\" detected in " + kind + ":"
                        + memberId + ". Reassigned to unique id.");
            }
            id = context.ids().next();
        }
        return new StbNode()
                .setAttr("id", id)
                .setAttr("id_member", memberId)
                .setAttr("kind_member", kind.name())
                .setAttr("id_section", idSection)
                .setAttr("starting_point", endpoint.startingPoint)
                .setAttr("distance", distance);
    }

    private static void clearJointAttributes(StbNode member, Endpoint endpoint) {
        member.removeAttr(endpoint.jointAttr);
        member.removeAttr(endpoint.kindAttr);
        member.removeAttr(endpoint.idAttr);
    }

    /**
     * Writes every arrangement back onto its member endpoint, found by {@code (kind_member, id_member)}
     * and {@code starting_point}, then removes the collection.
     */
    public static void convertJointsTo202(StbDocument document, RuleContext context) {
        StbNode members = XmlHelper.getMembers(document).orElse(null);
        List<StbNode> arrangements = XmlHelper.all(members, ARRANGEMENTS, ARRANGEMENT);
        if (arrangements.isEmpty()) {
            context.report().debug("No StbJointArrangements found, skipping Joint conversion");
            return;
        }

        Map<String, StbNode> byKey = new HashMap<>();
        for (MemberKind kind : MemberKind.values()) {
            for (StbNode member : XmlHelper.collect(members, kind.container, kind.element)) {
                byKey.put(kind.name() + ":" + member.attr("id"), member);
            }
        }

        int converted = 0;
        for (StbNode arrangement : arrangements) {
            String kindName = arrangement.attr("kind_member");
            StbNode member = byKey.get(kindName + ":" + arrangement.attr("id_member"));
            if (member == null) {
                context.report().warn("StbJointArrangement " + arrangement.attr("id") + ": Member " + kindName
                        + ":" + arrangement.attr("id_member") + " not found");
                continue;
            }
            String startingPoint = arrangement.hasAttr("starting_point")
                    ? arrangement.attr("starting_point") : arrangement.attr("pos");
            Endpoint endpoint = endpointFor(MemberKind.valueOf(kindName), startingPoint);
            if (endpoint == null) {
                context.report().warn("StbJointArrangement " + arrangement.attr("id") + ": Unknown starting_point \""
                        + startingPoint + "\"");
                continue;
            }
            member.setAttr(endpoint.jointAttr, arrangement.hasAttr("distance")
                    ? arrangement.attr("distance") : arrangement.attr("joint"));
            member.setAttr(endpoint.kindAttr, arrangement.attr("kind_joint"));
            member.setAttr(endpoint.idAttr, arrangement.attr("id"));
            converted++;
        }
        members.removeChildren(ARRANGEMENTS);
        if (converted > 0) {
            context.report().info("Joint elements: Converted " + converted + " joints to v2.0.2 format");
        }
    }

    static Endpoint endpointFor(MemberKind kind, String startingPoint) {
        for (Endpoint endpoint : kind.endpoints) {
            if (endpoint.startingPoint.equals(startingPoint)) {
                return endpoint;
            }
        }
        return null;
    }
}
