package com.ranquality.service;

import com.ranquality.domain.window.EvaluationWindows;

import java.time.LocalDate;

/** Latest data date of a site and, when an input date was given, the windows it would produce. */
public record WindowPreview(String site, LocalDate inputDate, LocalDate maxDate, EvaluationWindows windows) {
}
