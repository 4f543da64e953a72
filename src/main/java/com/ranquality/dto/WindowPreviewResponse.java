package com.ranquality.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.ranquality.domain.window.EvaluationWindows;
import com.ranquality.service.WindowPreview;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/** Windows and warnings are empty when no input date was given. */
@Value
@Builder
public class WindowPreviewResponse {
    String siteAtt;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate inputDate;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate maxDate;
    List<EvaluationResponse.WindowResponse> windows;
    List<String> warnings;

    public static WindowPreviewResponse from(WindowPreview preview) {
        EvaluationWindows windows = preview.windows();
        return WindowPreviewResponse.builder()
            .siteAtt(preview.site())
            .inputDate(preview.inputDate())
            .maxDate(preview.maxDate())
            .windows(windows == null ? List.of() : windows.all().stream().map(EvaluationResponse::toWindow).toList())
            .warnings(windows == null ? List.of() : windows.warnings())
            .build();
    }
}
