package com.pocketplan.forecast.controller;

import com.pocketplan.forecast.controller.dto.NonBankDaysResponseDto;
import com.pocketplan.forecast.service.BankDayService;
import com.pocketplan.forecast.web.RequestContextHolder;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/bank-days")
public class BankDaysController {

    private final BankDayService bankDayService;

    public BankDaysController(BankDayService bankDayService) {
        this.bankDayService = bankDayService;
    }

    @GetMapping("/non-bank-days")
    public ResponseEntity<NonBankDaysResponseDto> getNonBankDays(
            @RequestParam("from_date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam("to_date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate,
            @RequestParam(value = "country", required = false) String country
    ) {
        String effectiveCountry = country == null || country.isBlank() ? bankDayService.defaultCountry() : country;
        List<LocalDate> dates = bankDayService.nonBankDays(effectiveCountry, fromDate, toDate);
        return ResponseEntity.ok(new NonBankDaysResponseDto(
                effectiveCountry.trim().toUpperCase(Locale.ROOT),
                dates,
                RequestContextHolder.traceId().orElse(null)));
    }
}
