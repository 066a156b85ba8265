package dao.tron.twallet;

import dao.tron.twallet.command.CommandRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TronWalletApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(
                SpringApplication.run(TronWalletApplication.class, CommandRunner.normalize(args))));
    }
}
