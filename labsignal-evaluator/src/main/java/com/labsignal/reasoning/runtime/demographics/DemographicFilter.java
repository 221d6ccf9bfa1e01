package com.labsignal.reasoning.runtime.demographics;

import com.labsignal.reasoning.api.model.DemographicConstraint;
import com.labsignal.reasoning.api.model.PatientProfile;

/**
 * Gate deciding whether a rule applies to a patient.
 *
 * <p>A rule without a constraint applies to everyone. A constrained rule never
 * applies when no profile was collected. Otherwise every field the constraint
 * sets must hold:
 * <ul>
 *   <li>sex must equal the patient's sex at birth; {@code prefer_not_say} and
 *       {@code intersex} never satisfy a sex constraint</li>
 *   <li>age bounds are inclusive</li>
 *   <li>pregnancy is compared with {@code pregnancyStatus == pregnant}, so an
 *       unknown status counts as not pregnant</li>
 * </ul>
 */
public final class DemographicFilter {

    private DemographicFilter() {
    }

    public static boolean applies(DemographicConstraint constraint, PatientProfile profile) {
        return reasonRejected(constraint, profile) == null;
    }

    /**
     * @return the first constraint field the profile fails, or null if the rule applies
     */
    public static String reasonRejected(DemographicConstraint constraint, PatientProfile profile) {
        if (constraint == null) {
            return null;
        }
        if (profile == null) {
            return "no patient profile for constraint " + constraint.id();
        }
        if (constraint.requiredSex() != null && constraint.requiredSex() != profile.sexAtBirth()) {
            return "requires sex " + constraint.requiredSex().code();
        }
        if ((constraint.minAge() != null || constraint.maxAge() != null) && profile.age() == null) {
            return "requires a known age";
        }
        if (constraint.minAge() != null && profile.age() < constraint.minAge()) {
            return "requires age >= " + constraint.minAge();
        }
        if (constraint.maxAge() != null && profile.age() > constraint.maxAge()) {
            return "requires age <= " + constraint.maxAge();
        }
        if (constraint.requiresPregnant() != null && constraint.requiresPregnant() != profile.isPregnant()) {
            return constraint.requiresPregnant() ? "requires pregnancy" : "excludes pregnancy";
        }
        return null;
    }
}
