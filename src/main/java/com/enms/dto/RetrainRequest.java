package com.enms.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Optional body of a manual retrain. Without drivers the active model's driver set is reused.
 */
@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
public class RetrainRequest {

    private List<String> drivers;
}
