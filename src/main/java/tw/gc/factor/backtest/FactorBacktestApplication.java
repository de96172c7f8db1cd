package tw.gc.factor.backtest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FactorBacktestApplication {

    public static void main(String[] args) {
        SpringApplication.run(FactorBacktestApplication.class, args);
    }
}
