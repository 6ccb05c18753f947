package com.sandkev.tradewise.web;

import com.sandkev.tradewise.portfolio.EquityCurveService;
import com.sandkev.tradewise.portfolio.EquityPoint;
import com.sandkev.tradewise.portfolio.HoldingsReport;
import com.sandkev.tradewise.portfolio.PortfolioSummary;
import com.sandkev.tradewise.portfolio.ValuationService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/portfolio")
@RequiredArgsConstructor
class PortfolioApi {

    private final ValuationService valuation;
    private final EquityCurveService equityCurve;

    @GetMapping("/summary")
    PortfolioSummary summary() { return valuation.summary(); }

    @GetMapping("/equity-curve")
    List<EquityPoint> equityCurve() { return equityCurve.equityCurve(); }

    // GET /portfolio/holdings?as_of=2024-01-31
    @GetMapping("/holdings")
    HoldingsReport holdings(@RequestParam(name = "as_of", required = false)
                            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return valuation.holdingsReport(asOf);
    }
}
