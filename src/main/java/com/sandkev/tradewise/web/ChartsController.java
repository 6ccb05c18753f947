package com.sandkev.tradewise.web;

import com.sandkev.tradewise.chart.ChartData;
import com.sandkev.tradewise.chart.ChartService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
class ChartsController {

    private final ChartService charts;

    @GetMapping("/charts/{symbol}")
    ChartData chart(@PathVariable("symbol") String symbol) { return charts.chart(symbol); }
}
