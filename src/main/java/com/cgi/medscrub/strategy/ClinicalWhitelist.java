package com.cgi.medscrub.strategy;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Clinical and temporal vocabulary that name heuristics must never redact.
 */
public final class ClinicalWhitelist {

    private static final Pattern WORD_SEPARATOR = Pattern.compile("[\\s,]+");

    private static final Set<String> TERMS = Set.of(
            "January", "February", "March", "April", "May", "June", "July", "August", "September",
            "October", "November", "December",
            "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday", "Sunday",
            "Doctor", "Patient", "Hospital", "Clinic", "Medical", "Health", "Treatment", "Diagnosis",
            "Blood", "Heart", "Liver", "Kidney", "Brain", "Lung", "Skin", "Bone",
            "Pressure", "Temperature", "Weight", "Height", "Pulse", "Rate",
            "Normal", "Abnormal", "Positive", "Negative", "Result", "Test", "Lab", "Study",
            "Emergency", "Discharge", "Admission", "Visit", "Appointment", "Follow", "Up",
            "General", "Internal", "External", "Primary", "Secondary", "Acute", "Chronic",
            "United", "States", "America", "North", "South", "East", "West", "Central",
            "History", "Present", "Illness", "Physical", "Examination", "Review", "Systems",
            "Chief", "Complaint", "Assessment", "Plan", "Medications", "Allergies", "Summary",
            // Prefixes of hyphenated clinical terms (Non-Hodgkin, Post-Op)
            "Non", "Pre", "Post", "Anti", "Self", "Op");

    private static final Set<String> ACRONYMS = Set.of(
            // Medical
            "CBC", "MRI", "CAT", "EKG", "ECG", "EEG", "EMG", "ICU", "CCU", "NICU", "PICU", "ER", "OR", "ED",
            "HIV", "AIDS", "COVID", "COPD", "CHF", "CAD", "GERD", "UTI", "DVT", "PE", "MI", "CVA", "TIA",
            "BMI", "BP", "HR", "RR", "SPO", "BUN", "WBC", "RBC", "HGB", "HCT", "PLT", "BMP", "CMP", "LFT",
            "TSH", "PSA", "HBA", "INR", "PTT", "ABG", "VBG", "CSF", "EGD", "ERCP", "PET", "CT", "US",
            "PRN", "BID", "TID", "QID", "QHS", "QAM", "QPM", "PO", "IV", "IM", "SQ", "SL", "PR", "TOP",
            "DNR", "DNI", "POLST", "HCP", "POA", "LTC", "SNF", "ALF", "ICD", "CPT", "DRG", "HCPCS",
            "STAT", "ASAP", "WNL", "NAD", "PERRLA", "ROS", "HPI", "PMH", "PSH", "FH", "SH", "RX", "DX", "TX",
            "SOB", "DOE", "PND", "JVD", "RUQ", "LUQ", "RLQ", "LLQ", "ROM", "DTR", "CN", "EOM",
            "AMA", "ADA", "HIPAA", "PHI", "EMR", "EHR", "CMS", "FDA", "CDC", "NIH", "WHO",
            // Document terms
            "PDF", "DOC", "PAGE", "DATE", "TIME", "NOTE", "NOTES", "FORM", "REPORT", "SUMMARY", "HISTORY",
            "NAME", "AGE", "SEX", "DOB", "MRN", "SSN", "ZIP", "FAX", "TEL", "EXT", "ID", "PATIENT",
            "MALE", "FEMALE", "YES", "NO", "NA", "TBD", "NKA", "NKDA", "NONE", "AND", "THE", "FOR", "WITH", "OF",
            // Section headers
            "SUBJECTIVE", "OBJECTIVE", "ASSESSMENT", "PLAN", "SOAP", "IMPRESSION", "RECOMMENDATION",
            "CHIEF", "COMPLAINT", "ALLERGIES", "MEDICATIONS", "VITALS", "EXAM", "LABS", "IMAGING",
            "PROCEDURE", "PROCEDURES", "SURGERY", "SURGERIES", "DIAGNOSIS", "DIAGNOSES",
            "PRESENT", "ILLNESS", "PHYSICAL", "EXAMINATION", "REVIEW", "SYSTEMS", "FAMILY", "SOCIAL",
            "DISCHARGE", "ADMISSION", "INSTRUCTIONS", "FINDINGS", "RESULTS", "NORMAL", "ABNORMAL",
            "POSITIVE", "NEGATIVE", "FOLLOW", "UP", "HOSPITAL", "CLINIC", "MEDICAL", "RECORD",
            // Temporal
            "JANUARY", "FEBRUARY", "MARCH", "APRIL", "MAY", "JUNE", "JULY", "AUGUST", "SEPTEMBER",
            "OCTOBER", "NOVEMBER", "DECEMBER", "JAN", "FEB", "MAR", "APR", "JUN", "JUL", "AUG", "SEP",
            "SEPT", "OCT", "NOV", "DEC",
            "MONDAY", "TUESDAY", "WEDNESDAY", "THURSDAY", "FRIDAY", "SATURDAY", "SUNDAY",
            "MON", "TUE", "WED", "THU", "FRI", "SAT", "SUN",
            // Other
            "USA", "UK", "EST", "PST", "CST", "MST", "UTC", "GMT", "AM", "PM");

    private static final Set<String> US_STATES = Set.of(
            "AL", "AK", "AZ", "AR", "CA", "CO", "CT", "DE", "FL", "GA",
            "HI", "ID", "IL", "IN", "IA", "KS", "KY", "LA", "ME", "MD",
            "MA", "MI", "MN", "MS", "MO", "MT", "NE", "NV", "NH", "NJ",
            "NM", "NY", "NC", "ND", "OH", "OK", "OR", "PA", "RI", "SC",
            "SD", "TN", "TX", "UT", "VT", "VA", "WA", "WV", "WI", "WY",
            "DC", "PR", "VI", "GU", "AS", "MP");

    private ClinicalWhitelist() {
    }

    /**
     * Exact match against the acronym list. Only an all-caps token can be an acronym,
     * so "Doe" or "Ed" are never mistaken for DOE or ED.
     */
    public static boolean isAcronym(String token) {
        return token != null && ACRONYMS.contains(token);
    }

    public static boolean isTerm(String word) {
        if (word == null || word.isEmpty()) {
            return false;
        }
        if (word.equals(word.toUpperCase(Locale.ROOT))) {
            return ACRONYMS.contains(word);
        }
        String normalized = word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
        return TERMS.contains(normalized);
    }

    public static boolean isUsState(String code) {
        return code != null && US_STATES.contains(code);
    }

    /**
     * Checks if every word of a phrase is whitelisted vocabulary.
     *
     * @param phrase Phrase made of words separated by spaces or commas
     * @return true if no word could be a name
     */
    public static boolean isEntirelyWhitelisted(String phrase) {
        return Arrays.stream(WORD_SEPARATOR.split(phrase.trim()))
                .filter(word -> !word.isEmpty())
                .map(word -> word.replaceAll("[^A-Za-z]", ""))
                .allMatch(word -> word.isEmpty() || isTerm(word));
    }

    /**
     * Checks if any word of a phrase is whitelisted vocabulary.
     *
     * @param phrase Phrase made of words separated by spaces or commas
     * @return true if at least one word is clinical or temporal vocabulary
     */
    public static boolean containsWhitelisted(String phrase) {
        return Arrays.stream(WORD_SEPARATOR.split(phrase.trim()))
                .map(word -> word.replaceAll("[^A-Za-z]", ""))
                .anyMatch(word -> !word.isEmpty() && isTerm(word));
    }
}
