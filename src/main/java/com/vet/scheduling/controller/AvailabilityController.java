package com.vet.scheduling.controller;

import com.vet.scheduling.dto.AvailabilityExceptionRequest;
import com.vet.scheduling.dto.AvailabilityRuleRequest;
import com.vet.scheduling.entity.AvailabilityException;
import com.vet.scheduling.entity.AvailabilityRule;
import com.vet.scheduling.service.AvailabilityService;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/vets/{vetId}/availability")
public class AvailabilityController {

    private final AvailabilityService availabilityService;

    public AvailabilityController(AvailabilityService availabilityService) {
        this.availabilityService = availabilityService;
    }

    @GetMapping("/rules")
    public List<AvailabilityRule> rules(@PathVariable String vetId) {
        return availabilityService.listRules(vetId);
    }

    @PostMapping("/rules")
    public ResponseEntity<AvailabilityRule> addRule(@PathVariable String vetId,
                                                    @Valid @RequestBody AvailabilityRuleRequest request) {
        AvailabilityRule rule = AvailabilityRule.builder()
                .vetId(vetId)
                .dayOfWeek(request.getDayOfWeek())
                .startTime(request.getStartTime())
                .endTime(request.getEndTime())
                .effectiveFrom(request.getEffectiveFrom())
                .effectiveUntil(request.getEffectiveUntil())
                .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(availabilityService.addRule(rule));
    }

    @DeleteMapping("/rules/{ruleId}")
    public ResponseEntity<Void> removeRule(@PathVariable String vetId, @PathVariable Long ruleId) {
        availabilityService.removeRule(vetId, ruleId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/exceptions")
    public List<AvailabilityException> exceptions(@PathVariable String vetId,
                                                  @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                                  @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return availabilityService.listExceptions(vetId, from, to);
    }

    @PostMapping("/exceptions")
    public ResponseEntity<AvailabilityException> addException(@PathVariable String vetId,
                                                              @Valid @RequestBody AvailabilityExceptionRequest request) {
        AvailabilityException exception = AvailabilityException.builder()
                .vetId(vetId)
                .exceptionDate(request.getDate())
                .startTime(request.getStartTime())
                .endTime(request.getEndTime())
                .kind(request.getKind())
                .reason(request.getReason())
                .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(availabilityService.addException(exception));
    }

    @DeleteMapping("/exceptions/{exceptionId}")
    public ResponseEntity<Void> removeException(@PathVariable String vetId, @PathVariable Long exceptionId) {
        availabilityService.removeException(vetId, exceptionId);
        return ResponseEntity.noContent().build();
    }
}
