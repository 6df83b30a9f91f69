package io.interviews.core.questionnaire.question;

/// Structural part of a selectable option. Its label lives in the localizations.
///
/// @param hasComment whether the respondent may attach a comment when choosing it
public record Option(boolean hasComment) {}
