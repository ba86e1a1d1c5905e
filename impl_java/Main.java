import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.PrintStream;
import proofChecking.Scripts;
import proofChecking.elaborator.ElaborationException;
import proofChecking.elaborator.Elaborator;
import proofChecking.kernel.Theorem;

public class Main {

    public static void main(String[] args) {

        if (args.length > 0 && !args[0].isEmpty()) {
            try {
                System.setOut(new PrintStream(new FileOutputStream(args[0]), true));
            } catch (FileNotFoundException e) {
                System.err.println("Could not redirect output to file, printing to console instead.");
                e.printStackTrace();
            }
        }

        boolean trace = false;
        if (args.length > 1) {
            if (args[1].equals("trace")) {
                trace = true;
            } else {
                System.err.println("Second argument must be \"trace\" to print each step. Ignoring it.");
            }
        }

        final var elaborator = new Elaborator();
        if (trace) {
            elaborator.setTrace(System.out);
        }

        final var startTime = System.currentTimeMillis();
        try {
            Theorem result = elaborator.check(Scripts.EXAMPLE);
            final var endTime = System.currentTimeMillis();
            System.out.println("Checked in " + (endTime - startTime) + "ms:");
            System.out.println(result);
            System.out.println("Theorem pool:");
            System.out.print(elaborator.getPool());
        } catch (ElaborationException e) {
            System.err.println("Proof check failed: " + e.getMessage());
            System.exit(1);
        }
    }
}
