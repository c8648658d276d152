package org.calista.qualia.integrate;

import com.fasterxml.jackson.annotation.JsonFormat;
import org.calista.qualia.analysis.affect.AffectPass;
import org.calista.qualia.analysis.position.PositionPass;

import java.util.List;
import java.util.function.Predicate;

/**
 * Fixed catalog of cross-module patterns. Each one is a conjunction over a turn profile.
 */
@JsonFormat(shape = JsonFormat.Shape.OBJECT)
public enum TriangulationPattern {

    CRISIS(
            "Trajectory curve + passive subject + elevated affect",
            List.of("A (trajectory)", "B (passive suffering)", "D (affect)"),
            "Is this a biographical turning point? How is the crisis worked through narratively?",
            p -> p.has(Flag.TRAJECTORY_CURVE)
                    && (p.has(Flag.PASSIVE) || PositionPass.PASSIVE_SUFFERING.equals(p.dominantAgency()))
                    && p.affectDensity() > 2.0),

    RESISTANCE(
            "System critique + active or moral agency",
            List.of("B (agency)", "C (system failure)"),
            "Does the respondent position themself as a resisting subject? Against whom or what?",
            p -> p.frames().containsKey(Frames.SYSTEM_FAILURE)
                    && (PositionPass.ACTIVE_AGENCY.equals(p.dominantAgency())
                    || PositionPass.MORAL_REFLECTION.equals(p.dominantAgency()))),

    AMBIVALENT_ATTACHMENT(
            "Vocation frame + economic pressure or ambivalence",
            List.of("C (vocation + economization)", "D (ambivalence)"),
            "How does the respondent negotiate inner conviction against outer pressure?",
            p -> p.frames().containsKey(Frames.VOCATION)
                    && (p.frames().containsKey(Frames.ECONOMIZATION)
                    || p.affectDimensions().contains(AffectPass.AMBIVALENCE))),

    NARRATIVE_TRANSFORMATION(
            "Transformation + text type shift, a possible reorientation",
            List.of("A (transformation)", "A (text type shift)"),
            "Is a move from suffering towards acting visible here?",
            p -> p.has(Flag.TRANSFORMATION) && p.transitions() >= 1),

    EMBODIED_AFFECT(
            "High affect density + bodily references",
            List.of("D (intensity)", "D (bodily reference)"),
            "Is something expressed here that cannot fully be put into words? Check the bodily dimension.",
            p -> p.affectDimensions().contains(AffectPass.BODILY_REFERENCE) && p.affectDensity() > 3.0);

    /** Frame names the catalog refers to. */
    public static final class Frames {
        public static final String SYSTEM_FAILURE = "SYSTEM_FAILURE";
        public static final String VOCATION = "VOCATION";
        public static final String ECONOMIZATION = "ECONOMIZATION";

        private Frames() {}
    }

    private final String description;
    private final List<String> modules;
    private final String checkQuestion;
    private final Predicate<TurnProfile> condition;

    TriangulationPattern(String description, List<String> modules, String checkQuestion, Predicate<TurnProfile> condition) {
        this.description = description;
        this.modules = modules;
        this.checkQuestion = checkQuestion;
        this.condition = condition;
    }

    public String getName() {
        return name();
    }

    public String getDescription() {
        return description;
    }

    public List<String> getModules() {
        return modules;
    }

    public String getCheckQuestion() {
        return checkQuestion;
    }

    public boolean matches(TurnProfile profile) {
        return condition.test(profile);
    }
}
