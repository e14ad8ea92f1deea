package com.enms.controller;

import com.enms.dto.BatchIngestResponse;
import com.enms.dto.MachineRequest;
import com.enms.dto.ReadingDTO;
import com.enms.model.Machine;
import com.enms.service.MachineService;
import com.enms.service.ReadingIngestService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Data intake: meter readings and the machine registry.
 *
 * Endpoints:
 * 1. POST /readings/batch - Ingest a batch of readings
 * 2. PUT /machines/{id} - Register or update a machine
 * 3. GET /machines - List active machines
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class ReadingController {

    private final ReadingIngestService ingestService;
    private final MachineService machineService;

    /**
     * Request body: JSON array of readings.
     * Invalid readings are reported per item in the response, not as a request failure.
     */
    @PostMapping("/readings/batch")
    public ResponseEntity<BatchIngestResponse> ingestBatch(@RequestBody List<ReadingDTO> readings) {
        log.info("Received batch of {} readings", readings.size());
        return ResponseEntity.ok(ingestService.ingestBatch(readings));
    }

    @PutMapping("/machines/{machineId}")
    public ResponseEntity<Machine> registerMachine(@PathVariable String machineId,
                                                   @RequestBody MachineRequest request) {
        return ResponseEntity.ok(machineService.register(machineId, request));
    }

    @GetMapping("/machines")
    public ResponseEntity<List<Machine>> listActiveMachines() {
        return ResponseEntity.ok(machineService.listActiveMachines());
    }
}
