package io.shopfront.fulfillment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Print options of a xerox order line.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Embeddable
public class PrintJobConfig {
    @Column(name = "print_paper_type")
    private String paperType;

    @Column(name = "print_color_option")
    private String colorOption;

    @Column(name = "print_format_type")
    private String formatType;

    @Column(name = "print_page_count")
    private Integer pageCount;

    @Column(name = "print_ratio")
    private String printRatio;

    @Column(name = "print_binding_type")
    private String bindingType;

    @Column(name = "print_lamination_type")
    private String laminationType;

    @Column(name = "print_copies")
    private Integer copies;

    @Column(name = "print_message", length = 1000)
    private String message;
}
