package com.rightsparser.service.extraction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Party names and title found in the agreement text before extraction. Absent values are null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgreementHints {
    private String licensor;
    private String licensee;
    private String title;

    public boolean isEmpty() {
        return licensor == null && licensee == null && title == null;
    }
}
