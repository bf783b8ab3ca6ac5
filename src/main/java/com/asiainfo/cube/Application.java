package com.asiainfo.cube;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;

/**
 * Quarkus 启动入口
 */
@QuarkusMain
public class Application {

    public static void main(String[] args) {
        Quarkus.run(App.class, args);
    }

    public static class App implements QuarkusApplication {

        @Override
        public int run(String... args) {
            System.out.println("╔════════════════════════════════════════════════╗");
            System.out.println("║           Cube Runtime Engine                  ║");
            System.out.println("║  Quarkus + SQLite 星型模型聚合引擎              ║");
            System.out.println("╚════════════════════════════════════════════════╝");
            Quarkus.waitForExit();
            return 0;
        }
    }
}
