package com.dcaswap.api.controller;

import com.dcaswap.api.dto.ApiResponse;
import com.dcaswap.api.dto.CreateScheduleRequest;
import com.dcaswap.api.dto.ErrorBody;
import com.dcaswap.api.dto.ScheduleResponse;
import com.dcaswap.api.dto.UpdateScheduleRequest;
import com.dcaswap.api.validation.EvmAddressValidator;
import com.dcaswap.dca.schedule.NewSchedule;
import com.dcaswap.dca.schedule.ScheduleService;
import com.dcaswap.domain.AppRef;
import com.dcaswap.domain.PkpInfo;
import com.dcaswap.domain.Schedule;
import com.dcaswap.domain.ScheduleEdit;
import com.dcaswap.domain.TokenRef;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.bson.types.ObjectId;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

/**
 * POST/GET /schedules, PUT/DELETE /schedules/{id}, PUT /schedules/{id}/enable|disable.
 */
@RestController
@RequestMapping("/api/v1/schedules")
@RequiredArgsConstructor
public class ScheduleController {

    private final ScheduleService scheduleService;

    @PostMapping
    public ResponseEntity<?> create(@RequestBody @Valid CreateScheduleRequest request) {
        Schedule created = scheduleService.create(toNewSchedule(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(ScheduleResponse.from(created)));
    }

    @GetMapping
    public ResponseEntity<?> list(@RequestParam(required = false) String ethAddress) {
        if (!EvmAddressValidator.isEvmAddress(ethAddress)) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "Invalid Ethereum address"));
        }
        List<ScheduleResponse> schedules = scheduleService.listByOwner(ethAddress).stream()
                .map(ScheduleResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(schedules));
    }

    @PutMapping("/{scheduleId}")
    public ResponseEntity<?> update(@PathVariable String scheduleId, @RequestBody @Valid UpdateScheduleRequest request) {
        if (!ObjectId.isValid(scheduleId)) {
            return invalidId();
        }
        Schedule updated = scheduleService.update(scheduleId, new ScheduleEdit(
                request.name(),
                new BigDecimal(request.purchaseAmount()),
                request.purchaseIntervalHuman(),
                toTokenRef(request.tokenIn()),
                toTokenRef(request.tokenOut())));
        return ResponseEntity.ok(ApiResponse.ok(ScheduleResponse.from(updated)));
    }

    @DeleteMapping("/{scheduleId}")
    public ResponseEntity<?> delete(@PathVariable String scheduleId) {
        if (!ObjectId.isValid(scheduleId)) {
            return invalidId();
        }
        scheduleService.delete(scheduleId);
        return ResponseEntity.ok(ApiResponse.ok(scheduleId));
    }

    @PutMapping("/{scheduleId}/enable")
    public ResponseEntity<?> enable(@PathVariable String scheduleId) {
        if (!ObjectId.isValid(scheduleId)) {
            return invalidId();
        }
        return ResponseEntity.ok(ApiResponse.ok(ScheduleResponse.from(scheduleService.enable(scheduleId))));
    }

    @PutMapping("/{scheduleId}/disable")
    public ResponseEntity<?> disable(@PathVariable String scheduleId) {
        if (!ObjectId.isValid(scheduleId)) {
            return invalidId();
        }
        return ResponseEntity.ok(ApiResponse.ok(ScheduleResponse.from(scheduleService.disable(scheduleId))));
    }

    private static ResponseEntity<ErrorBody> invalidId() {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_SCHEDULE_ID", "Invalid ObjectId"));
    }

    private static NewSchedule toNewSchedule(CreateScheduleRequest r) {
        return new NewSchedule(
                r.name(),
                new AppRef(r.app().id(), r.app().version()),
                new PkpInfo(r.pkpInfo().ethAddress(), r.pkpInfo().publicKey(), r.pkpInfo().tokenId()),
                new BigDecimal(r.purchaseAmount()),
                r.purchaseIntervalHuman(),
                toTokenRef(r.tokenIn()),
                toTokenRef(r.tokenOut()));
    }

    private static TokenRef toTokenRef(CreateScheduleRequest.Token t) {
        return new TokenRef(t.address(), t.decimals(), t.symbol());
    }
}
