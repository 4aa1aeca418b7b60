package com.bit.arena;

import com.bit.arena.util.Secp256k1Signer;
import com.bit.arena.util.Sha;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.bit.arena")
public class ArenaApplication {
    public static void main(String[] args) {
        SpringApplication.run(ArenaApplication.class, args);

        long start = System.currentTimeMillis();
        Secp256k1Signer.generateKey();
        Sha.applyKeccak256("warmup");
        log.info("预热耗时{}ms",System.currentTimeMillis()-start);
    }
    //二进制统一大端，整数按 uint256 左填充
}
